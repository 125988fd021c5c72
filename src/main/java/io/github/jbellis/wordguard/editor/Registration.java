package io.github.jbellis.wordguard.editor;

/**
 * Handle returned by the editor's register methods; closing it unregisters.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {
    @Override
    void close();
}
