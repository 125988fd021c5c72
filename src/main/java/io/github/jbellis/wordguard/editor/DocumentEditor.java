package io.github.jbellis.wordguard.editor;

import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.data.MutableDataSet;
import io.github.jbellis.wordguard.dom.DocumentTrees;
import io.github.jbellis.wordguard.dom.NodeTypeRegistry;
import io.github.jbellis.wordguard.dom.UpdateEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Single-threaded host for an editable jsoup document.
 * <p>
 * All changes go through {@link #update(Consumer)}. One update cycle applies the caller's change,
 * normalizes text, runs the registered transforms until they settle, keys new elements, commits a
 * snapshot and then notifies mutation listeners followed by update listeners. Updates requested
 * while a cycle is in progress are queued and run after it, so no cycle ever interleaves with
 * another.
 */
public final class DocumentEditor {
    private static final Logger logger = LogManager.getLogger(DocumentEditor.class);

    /** Attribute holding the editor's key for each element. Stripped on export. */
    public static final String NODE_KEY_ATTRIBUTE = "data-node-key";

    static final int MAX_TRANSFORM_PASSES = 64;

    private final NodeTypeRegistry nodeTypes;
    private final DataHolder options;

    private Document live;
    private EditorState committed;
    private long nextKey = 1;

    private final List<EditorTransform> transforms = new ArrayList<>();
    private final List<UpdateListener> updateListeners = new ArrayList<>();
    private final List<MutationListener> mutationListeners = new ArrayList<>();
    private final Map<EditorCommand, List<CommandHandler>> commandHandlers = new LinkedHashMap<>();

    private final Deque<Consumer<Document>> pending = new ArrayDeque<>();
    private boolean updating;

    public DocumentEditor(Document document) {
        this(document, NodeTypeRegistry.loadDefault(), new MutableDataSet());
    }

    public DocumentEditor(Document document, NodeTypeRegistry nodeTypes, DataHolder options) {
        this.nodeTypes = nodeTypes;
        this.options = options;
        this.live = document;
        live.outputSettings().prettyPrint(false);
        DocumentTrees.normalizeText(live.body());
        assignKeys();
        this.committed = EditorState.capture(live);
        logger.debug("Editor created with {} keyed elements", committed.nodeMap().size());
    }

    public NodeTypeRegistry nodeTypes() {
        return nodeTypes;
    }

    public DataHolder options() {
        return options;
    }

    /**
     * The last committed snapshot. Callers must treat it as read-only.
     */
    public EditorState getEditorState() {
        return committed;
    }

    /**
     * Looks up a live element by key. Only meaningful inside an update.
     */
    public Element elementByKey(String key) {
        for (var element : DocumentTrees.elements(live.body())) {
            if (key.equals(element.attr(NODE_KEY_ATTRIBUTE))) {
                return element;
            }
        }
        return null;
    }

    /**
     * Applies {@code change} to the live document and commits the result. If {@code change} or a
     * transform throws, the live document is reset to the last committed snapshot, queued updates
     * are dropped and the exception propagates.
     */
    public void update(Consumer<Document> change) {
        pending.add(change);
        if (updating) {
            return;
        }

        updating = true;
        try {
            while (!pending.isEmpty()) {
                runCycle(pending.poll());
            }
        } catch (RuntimeException e) {
            pending.clear();
            live = committed.document().clone();
            throw e;
        } finally {
            updating = false;
        }
    }

    private void runCycle(Consumer<Document> change) {
        // apply the change and let transforms settle before anything is keyed or compared
        change.accept(live);
        DocumentTrees.normalizeText(live.body());
        runTransforms();
        assignKeys();

        // diff against the last commit; nothing to publish if the body is unchanged
        var previous = committed;
        var next = EditorState.capture(live);
        var mutations = EditorState.diff(previous, next);
        if (mutations.isEmpty() && previous.html().equals(next.html())) {
            logger.trace("Update produced no change");
            return;
        }
        committed = next;

        var nodeMap = EditorState.resolve(mutations, previous, next);
        var event = new UpdateEvent(previous.document(), next.document(), mutations, nodeMap);
        logger.debug("Committed update with {} element mutations", mutations.size());

        // mutation listeners first, then update listeners; copies so listeners may unregister
        if (event.hasMutations()) {
            for (var listener : List.copyOf(mutationListeners)) {
                try {
                    listener.onMutations(mutations, nodeMap);
                } catch (RuntimeException e) {
                    logger.error("Mutation listener {} failed", listener, e);
                }
            }
        }
        for (var listener : List.copyOf(updateListeners)) {
            try {
                listener.onUpdate(event);
            } catch (RuntimeException e) {
                logger.error("Update listener {} failed", listener, e);
            }
        }
    }

    private void runTransforms() {
        for (int pass = 1; pass <= MAX_TRANSFORM_PASSES; pass++) {
            boolean changed = false;
            for (var transform : List.copyOf(transforms)) {
                changed |= transform.transform(live);
            }
            if (!changed) {
                return;
            }
            DocumentTrees.normalizeText(live.body());
        }
        throw new IllegalStateException("Transforms did not settle after " + MAX_TRANSFORM_PASSES + " passes");
    }

    private void assignKeys() {
        var elements = DocumentTrees.elements(live.body());
        for (var element : elements) {
            var key = element.attr(NODE_KEY_ATTRIBUTE);
            if (!key.isEmpty()) {
                bumpPast(key);
            }
        }

        var seen = new HashSet<String>();
        for (var element : elements) {
            var key = element.attr(NODE_KEY_ATTRIBUTE);
            if (key.isEmpty() || !seen.add(key)) {
                key = "k" + nextKey++;
                element.attr(NODE_KEY_ATTRIBUTE, key);
                seen.add(key);
            }
        }
    }

    private void bumpPast(String key) {
        // keys loaded with the document may collide with ones we generate later
        var digits = key.substring(1);
        if (key.charAt(0) == 'k' && !digits.isEmpty() && digits.length() < 18
                && digits.chars().allMatch(Character::isDigit)) {
            nextKey = Math.max(nextKey, Long.parseLong(digits) + 1);
        }
    }

    public Registration registerTransform(EditorTransform transform) {
        transforms.add(transform);
        return () -> transforms.remove(transform);
    }

    public Registration registerUpdateListener(UpdateListener listener) {
        updateListeners.add(listener);
        return () -> updateListeners.remove(listener);
    }

    public Registration registerMutationListener(MutationListener listener) {
        mutationListeners.add(listener);
        return () -> mutationListeners.remove(listener);
    }

    public Registration registerCommand(EditorCommand command, CommandHandler handler) {
        commandHandlers.computeIfAbsent(command, c -> new ArrayList<>()).add(handler);
        return () -> commandHandlers.getOrDefault(command, new ArrayList<>()).remove(handler);
    }

    /**
     * Offers {@code command} to its handlers in registration order.
     *
     * @return true if a handler handled it
     */
    public boolean dispatchCommand(EditorCommand command) {
        for (var handler : List.copyOf(commandHandlers.getOrDefault(command, List.of()))) {
            if (handler.handle(command)) {
                return true;
            }
        }
        logger.debug("Command {} was not handled", command.name());
        return false;
    }
}
