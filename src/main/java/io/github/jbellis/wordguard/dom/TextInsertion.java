package io.github.jbellis.wordguard.dom;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Inserts typed text next to a node, honouring the insertion policy of its {@link NodeType}.
 * <p>
 * Text typed at the edge of a plain text node is merged into it. Text typed at the edge of an
 * element whose type forbids insertion on that side becomes a new sibling text node; other
 * elements receive the text inside, at their first or last position.
 */
public final class TextInsertion {
    private final NodeTypeRegistry registry;

    public TextInsertion(NodeTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return the text node that now holds {@code text}
     */
    public TextNode insertBefore(Node anchor, String text) {
        if (DocumentTrees.isPlainText(anchor)) {
            var node = (TextNode) anchor;
            node.text(text + node.getWholeText());
            return node;
        }
        if (!(anchor instanceof Element element)) {
            throw new IllegalArgumentException("Cannot insert text next to a " + anchor.nodeName() + " node");
        }
        boolean allowed = registry.typeOf(element).map(NodeType::canInsertTextBefore).orElse(true);
        var inserted = new TextNode(text);
        if (allowed) {
            element.prependChild(inserted);
        } else {
            element.before(inserted);
        }
        return inserted;
    }

    /**
     * @return the text node that now holds {@code text}
     */
    public TextNode insertAfter(Node anchor, String text) {
        if (DocumentTrees.isPlainText(anchor)) {
            var node = (TextNode) anchor;
            node.text(node.getWholeText() + text);
            return node;
        }
        if (!(anchor instanceof Element element)) {
            throw new IllegalArgumentException("Cannot insert text next to a " + anchor.nodeName() + " node");
        }
        boolean allowed = registry.typeOf(element).map(NodeType::canInsertTextAfter).orElse(true);
        var inserted = new TextNode(text);
        if (allowed) {
            element.appendChild(inserted);
        } else {
            element.after(inserted);
        }
        return inserted;
    }
}
