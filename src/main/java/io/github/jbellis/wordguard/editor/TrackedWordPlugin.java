package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.track.LifecycleTracker;
import io.github.jbellis.wordguard.track.TrackedNamespace;
import io.github.jbellis.wordguard.track.WordDeletionSink;

/**
 * Reports tracked words of one namespace that leave the document.
 */
public final class TrackedWordPlugin implements Registration {
    private final LifecycleTracker tracker;
    private final Registration listener;

    private TrackedWordPlugin(DocumentEditor editor, LifecycleTracker tracker) {
        this.tracker = tracker;
        this.listener = editor.registerUpdateListener(tracker::onCommit);
    }

    public static TrackedWordPlugin install(DocumentEditor editor, TrackedNamespace namespace, WordDeletionSink sink) {
        return new TrackedWordPlugin(editor, new LifecycleTracker(namespace, sink));
    }

    public TrackedNamespace namespace() {
        return tracker.namespace();
    }

    @Override
    public void close() {
        listener.close();
    }
}
