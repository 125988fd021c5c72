package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.dom.NodeMutation;
import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * Notified after a committed update that created, updated or destroyed at least one element.
 */
@FunctionalInterface
public interface MutationListener {
    void onMutations(Map<String, NodeMutation> mutations, Map<String, Element> nodeMap);
}
