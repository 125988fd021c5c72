package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.track.WordDeletionSink;

/**
 * The external document store: told when a tracked word is deleted and when content changes.
 */
public interface DocumentSink extends WordDeletionSink {
    /**
     * @param html the exported body HTML after the update
     */
    void onContentChanged(String html);
}
