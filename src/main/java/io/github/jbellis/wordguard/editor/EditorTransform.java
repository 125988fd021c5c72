package io.github.jbellis.wordguard.editor;

import org.jsoup.nodes.Document;

/**
 * Rewrites the live document during an update. Transforms run repeatedly until none of them
 * reports a change.
 */
@FunctionalInterface
public interface EditorTransform {
    /**
     * @return true if the document was modified
     */
    boolean transform(Document document);
}
