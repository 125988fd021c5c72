package io.github.jbellis.wordguard.dom;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * Everything a listener learns about one committed update.
 *
 * @param previous  snapshot before the update; must not be modified
 * @param current   snapshot after the update; must not be modified
 * @param mutations element key to lifecycle event, in document order
 * @param nodeMap   element key to element; destroyed keys resolve into {@code previous}
 */
public record UpdateEvent(Document previous,
                          Document current,
                          Map<String, NodeMutation> mutations,
                          Map<String, Element> nodeMap) {
    public boolean hasMutations() {
        return !mutations.isEmpty();
    }
}
