package io.github.jbellis.wordguard.editor;

/**
 * A named command that plugins can handle, e.g. forcing a block id pass.
 */
public record EditorCommand(String name) {
}
