package io.github.jbellis.wordguard.dom;

import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read and structural helpers over a jsoup document. Every method that returns nodes returns a
 * detached list, so callers may mutate the tree while iterating it.
 */
public final class DocumentTrees {
    private DocumentTrees() {
    }

    /**
     * All plain text leaves below {@code root}, in document order.
     */
    public static List<TextNode> textLeaves(Element root) {
        var leaves = new ArrayList<TextNode>();
        NodeTraversor.traverse((node, depth) -> {
            if (isPlainText(node)) {
                leaves.add((TextNode) node);
            }
        }, root);
        return leaves;
    }

    /**
     * The top-level blocks of a document: the child nodes of its body.
     */
    public static List<Node> blocks(Document document) {
        return new ArrayList<>(document.body().childNodes());
    }

    /**
     * Elements strictly below {@code root}, in document order.
     */
    public static List<Element> elements(Element root) {
        var all = root.getAllElements();
        return new ArrayList<>(all.subList(1, all.size()));
    }

    /**
     * Merges adjacent plain text siblings and removes empty ones. Elements, whatever their type,
     * are never merged with text.
     *
     * @return the number of text nodes removed
     */
    public static int normalizeText(Element root) {
        int removed = 0;
        for (var element : root.getAllElements()) {
            TextNode previous = null;
            for (var child : new ArrayList<>(element.childNodes())) {
                if (!isPlainText(child)) {
                    previous = null;
                    continue;
                }
                var text = (TextNode) child;
                if (text.getWholeText().isEmpty()) {
                    text.remove();
                    removed++;
                } else if (previous != null) {
                    previous.text(previous.getWholeText() + text.getWholeText());
                    text.remove();
                    removed++;
                } else {
                    previous = text;
                }
            }
        }
        return removed;
    }

    static boolean isPlainText(Node node) {
        return node instanceof TextNode && !(node instanceof CDataNode);
    }
}
