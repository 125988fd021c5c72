package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.blockid.BlockIdAssigner;

/**
 * Keeps a unique id on every top-level block: after each update that creates or changes a block,
 * and whenever {@link #ADD_UNIQUE_ATTRIBUTE_COMMAND} is dispatched.
 */
public final class UniqueAttributePlugin implements Registration {
    public static final EditorCommand ADD_UNIQUE_ATTRIBUTE_COMMAND = new EditorCommand("ADD_UNIQUE_ATTRIBUTE_COMMAND");

    private final BlockIdAssigner assigner;
    private final Registration mutations;
    private final Registration command;

    private UniqueAttributePlugin(DocumentEditor editor, BlockIdAssigner assigner) {
        this.assigner = assigner;
        this.mutations = editor.registerMutationListener(
                (changes, nodeMap) -> editor.update(document -> assigner.onMutations(document, changes, nodeMap)));
        this.command = editor.registerCommand(ADD_UNIQUE_ATTRIBUTE_COMMAND, c -> {
            editor.update(assigner::assign);
            return true;
        });
    }

    public static UniqueAttributePlugin install(DocumentEditor editor) {
        return new UniqueAttributePlugin(editor, new BlockIdAssigner(editor.options()));
    }

    public String attribute() {
        return assigner.attribute();
    }

    @Override
    public void close() {
        mutations.close();
        command.close();
    }
}
