package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.dom.DocumentTrees;
import io.github.jbellis.wordguard.dom.NodeMutation;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A committed, read-only snapshot of the document together with its keyed elements.
 */
public final class EditorState {
    private final Document document;
    private final Map<String, Element> nodeMap;
    private final String html;

    private EditorState(Document document, Map<String, Element> nodeMap) {
        this.document = document;
        this.nodeMap = nodeMap;
        this.html = document.body().html();
    }

    /**
     * Snapshots {@code live}. Every element below the body must already carry a unique key.
     */
    static EditorState capture(Document live) {
        var copy = live.clone();
        var nodeMap = new LinkedHashMap<String, Element>();
        for (var element : DocumentTrees.elements(copy.body())) {
            nodeMap.put(element.attr(DocumentEditor.NODE_KEY_ATTRIBUTE), element);
        }
        return new EditorState(copy, Collections.unmodifiableMap(nodeMap));
    }

    public Document document() {
        return document;
    }

    public Map<String, Element> nodeMap() {
        return nodeMap;
    }

    String html() {
        return html;
    }

    /**
     * Lifecycle events between {@code previous} and {@code next}: created and updated keys in the
     * order of {@code next}, then destroyed keys in the order of {@code previous}. An element is
     * updated when its serialized form changed, which includes changes below it.
     */
    static Map<String, NodeMutation> diff(EditorState previous, EditorState next) {
        var mutations = new LinkedHashMap<String, NodeMutation>();
        for (var entry : next.nodeMap.entrySet()) {
            var before = previous.nodeMap.get(entry.getKey());
            if (before == null) {
                mutations.put(entry.getKey(), NodeMutation.CREATED);
            } else if (!before.outerHtml().equals(entry.getValue().outerHtml())) {
                mutations.put(entry.getKey(), NodeMutation.UPDATED);
            }
        }
        for (var key : previous.nodeMap.keySet()) {
            if (!next.nodeMap.containsKey(key)) {
                mutations.put(key, NodeMutation.DESTROYED);
            }
        }
        return mutations;
    }

    /**
     * Resolves each mutated key: destroyed keys into {@code previous}, the rest into {@code next}.
     */
    static Map<String, Element> resolve(Map<String, NodeMutation> mutations, EditorState previous, EditorState next) {
        var resolved = new LinkedHashMap<String, Element>();
        mutations.forEach((key, mutation) -> {
            var source = mutation == NodeMutation.DESTROYED ? previous : next;
            resolved.put(key, source.nodeMap.get(key));
        });
        return resolved;
    }
}
