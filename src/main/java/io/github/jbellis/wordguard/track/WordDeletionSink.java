package io.github.jbellis.wordguard.track;

/**
 * Receives the logical ids of tracked words that left the document.
 * <p>
 * Implementations must tolerate being called more than once for the same id.
 */
@FunctionalInterface
public interface WordDeletionSink {
    void onWordDeleted(String id);
}
