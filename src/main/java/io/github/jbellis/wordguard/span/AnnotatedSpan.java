package io.github.jbellis.wordguard.span;

import com.vladsch.flexmark.util.data.DataHolder;
import io.github.jbellis.wordguard.flex.WordguardOptions;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Typed view over an element that marks one dictionary hit.
 * <p>
 * Markup: {@code <span class="foreign-word-highlight" data-foreign-word="true" data-term="coffee"
 * data-replacement="brew" title="coffee → brew" originid="...">coffee</span>}. The live text may
 * drift from {@code data-term} after edits; the engine reverts such spans on the next settle.
 */
public final class AnnotatedSpan {
    public static final String MARKER_ATTRIBUTE = "data-foreign-word";
    public static final String TERM_ATTRIBUTE = "data-term";
    public static final String REPLACEMENT_ATTRIBUTE = "data-replacement";

    private final Element element;
    private final String idAttribute;

    private AnnotatedSpan(Element element, String idAttribute) {
        this.element = element;
        this.idAttribute = idAttribute;
    }

    /**
     * Wraps an existing span element.
     *
     * @throws IllegalArgumentException if the node is not an annotated span
     */
    public static AnnotatedSpan wrap(Node node, DataHolder options) {
        if (!isAnnotatedSpan(node)) {
            throw new IllegalArgumentException("Not an annotated span: " + node.nodeName());
        }
        return new AnnotatedSpan((Element) node, WordguardOptions.SPAN_ID_ATTRIBUTE.get(options));
    }

    static AnnotatedSpan create(String text, String replacement, String logicalId, DataHolder options) {
        var element = new Element(WordguardOptions.SPAN_TAG.get(options));
        element.addClass(WordguardOptions.SPAN_CLASS.get(options))
               .attr(MARKER_ATTRIBUTE, "true")
               .attr(TERM_ATTRIBUTE, text)
               .attr(REPLACEMENT_ATTRIBUTE, replacement)
               .attr("title", title(text, replacement))
               .appendText(text);
        var idAttribute = WordguardOptions.SPAN_ID_ATTRIBUTE.get(options);
        if (logicalId != null) {
            element.attr(idAttribute, logicalId);
        }
        return new AnnotatedSpan(element, idAttribute);
    }

    public static boolean isAnnotatedSpan(Node node) {
        return node instanceof Element element && element.hasAttr(MARKER_ATTRIBUTE);
    }

    private static String title(String text, String replacement) {
        return text + " → " + replacement;
    }

    public Element element() {
        return element;
    }

    /**
     * Current text content, including any edits made since the span was created.
     */
    public String text() {
        return element.wholeText();
    }

    /**
     * The term the span was created for.
     */
    public String sourceText() {
        return element.hasAttr(TERM_ATTRIBUTE) ? element.attr(TERM_ATTRIBUTE) : text();
    }

    public String replacement() {
        return element.attr(REPLACEMENT_ATTRIBUTE);
    }

    public void setReplacement(String replacement) {
        if (replacement == null || replacement.isEmpty()) {
            throw new IllegalArgumentException("Replacement must not be empty");
        }
        element.attr(REPLACEMENT_ATTRIBUTE, replacement);
        element.attr("title", title(sourceText(), replacement));
    }

    /**
     * The logical id, or null if the host never assigned one.
     */
    public String logicalId() {
        var id = element.attr(idAttribute);
        return id.isEmpty() ? null : id;
    }

    @Override
    public String toString() {
        return "AnnotatedSpan[" + text() + " -> " + replacement() + "]";
    }
}
