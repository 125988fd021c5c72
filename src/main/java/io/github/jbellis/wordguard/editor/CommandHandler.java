package io.github.jbellis.wordguard.editor;

@FunctionalInterface
public interface CommandHandler {
    /**
     * @return true if the command was handled and no further handler should run
     */
    boolean handle(EditorCommand command);
}
