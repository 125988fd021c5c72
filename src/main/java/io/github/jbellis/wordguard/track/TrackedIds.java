package io.github.jbellis.wordguard.track;

import io.github.jbellis.wordguard.dom.AttributeStores;
import io.github.jbellis.wordguard.dom.DocumentTrees;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the tracked ids present in a tree.
 */
public final class TrackedIds {
    private TrackedIds() {
    }

    /**
     * For every text leaf below {@code root}, reads {@code attributeName} from the nearest enclosing
     * element that carries it, stopping at {@code root}. An element whose text is gone no longer
     * counts as present; one whose text was wrapped in further elements still does.
     */
    public static Set<String> collect(Element root, String attributeName) {
        var ids = new LinkedHashSet<String>();
        for (var leaf : DocumentTrees.textLeaves(root)) {
            var id = enclosingId(leaf, root, attributeName);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static String enclosingId(Node leaf, Element root, String attributeName) {
        for (var node = leaf.parent(); node != null; node = node.parent()) {
            var id = AttributeStores.read(node, attributeName);
            if (id != null) {
                return id;
            }
            if (node == root) {
                break;
            }
        }
        return null;
    }

    /**
     * Ids in {@code previous} that are missing from {@code current}.
     */
    public static Set<String> deleted(Set<String> previous, Set<String> current) {
        var deleted = new LinkedHashSet<>(previous);
        deleted.removeAll(current);
        return deleted;
    }
}
