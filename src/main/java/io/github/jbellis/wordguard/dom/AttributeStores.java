package io.github.jbellis.wordguard.dom;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.Optional;

/**
 * Resolves the attribute store of a jsoup node. Only elements carry attributes; text, comment and
 * data nodes have no store.
 */
public final class AttributeStores {
    private AttributeStores() {
    }

    public static Optional<AttributeStore> of(Node node) {
        if (node instanceof Element element) {
            return Optional.of(new ElementAttributeStore(element));
        }
        return Optional.empty();
    }

    /**
     * Reads an attribute from a node, returning null when the node has no store or no value.
     */
    public static String read(Node node, String name) {
        return of(node).map(store -> store.get(name)).orElse(null);
    }

    private record ElementAttributeStore(Element element) implements AttributeStore {
        @Override
        public String get(String name) {
            if (!element.hasAttr(name)) {
                return null;
            }
            var value = element.attr(name);
            return value.isEmpty() ? null : value;
        }

        @Override
        public void set(String name, String value) {
            element.attr(name, value);
        }
    }
}
