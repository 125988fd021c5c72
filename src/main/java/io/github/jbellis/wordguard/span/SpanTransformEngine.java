package io.github.jbellis.wordguard.span;

import com.vladsch.flexmark.util.data.DataHolder;
import io.github.jbellis.wordguard.dom.DocumentTrees;
import io.github.jbellis.wordguard.dom.NodeType;
import io.github.jbellis.wordguard.dom.NodeTypeRegistry;
import io.github.jbellis.wordguard.flex.IdProvider;
import io.github.jbellis.wordguard.flex.WordguardOptions;
import io.github.jbellis.wordguard.trie.Match;
import io.github.jbellis.wordguard.trie.TrieMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites text nodes into annotated spans and reverts spans whose text no longer matches a term.
 * <p>
 * {@link #settle(Element)} runs the reverse pass first so that stale spans are back to plain text
 * before the forward pass looks for matches. Both passes collect the nodes they will touch before
 * mutating anything.
 */
public final class SpanTransformEngine {
    private static final Logger logger = LogManager.getLogger(SpanTransformEngine.class);

    private final TrieMatcher matcher;
    private final NodeType spanType;
    private final DataHolder options;
    private final IdProvider idProvider;
    private final String idPrefix;

    private SpanTransformEngine(TrieMatcher matcher, NodeType spanType, DataHolder options) {
        this.matcher = matcher;
        this.spanType = spanType;
        this.options = options;
        this.idProvider = IdProvider.ID_PROVIDER.get(options);
        this.idPrefix = WordguardOptions.SPAN_ID_PREFIX.get(options);
    }

    /**
     * Creates an engine for a host whose node types are {@code registry}.
     *
     * @throws IllegalStateException if the registry does not contain the annotated span type
     */
    public static SpanTransformEngine attach(NodeTypeRegistry registry, TrieMatcher matcher, DataHolder options) {
        var spanType = registry.get(AnnotatedSpanType.TYPE_NAME)
                               .orElseThrow(() -> new IllegalStateException(
                                       "SpanTransformEngine: node type '" + AnnotatedSpanType.TYPE_NAME
                                       + "' is not registered with the host"));
        logger.info("Attached span engine ({} terms)", matcher.size());
        return new SpanTransformEngine(matcher, spanType, options);
    }

    public TrieMatcher matcher() {
        return matcher;
    }

    /**
     * Runs one reverse pass followed by one forward pass over {@code root}.
     */
    public SettleResult settle(Element root) {
        int reverted = revertDivergent(root);
        int annotated = annotate(root);
        if (reverted > 0 || annotated > 0) {
            logger.debug("Settled: {} spans reverted, {} spans created", reverted, annotated);
        }
        return new SettleResult(reverted, annotated);
    }

    /**
     * Replaces every annotated span whose live text is not a dictionary term with plain text.
     *
     * @return the number of spans reverted
     */
    public int revertDivergent(Element root) {
        var spans = new ArrayList<Element>();
        for (var element : root.getAllElements()) {
            if (element != root && spanType.matches(element)) {
                spans.add(element);
            }
        }

        int reverted = 0;
        for (var element : spans) {
            var text = element.wholeText();
            if (!matcher.search(text)) {
                logger.debug("Reverting span '{}' (was '{}')", text, element.attr(AnnotatedSpan.TERM_ATTRIBUTE));
                element.replaceWith(new TextNode(text));
                reverted++;
            }
        }
        return reverted;
    }

    /**
     * Splits every plain text node outside existing spans around its dictionary matches.
     *
     * @return the number of spans created
     */
    public int annotate(Element root) {
        var pending = new ArrayList<TextNode>();
        for (var leaf : DocumentTrees.textLeaves(root)) {
            if (!leaf.getWholeText().isEmpty() && !insideSpan(leaf, root)) {
                pending.add(leaf);
            }
        }

        int created = 0;
        for (var leaf : pending) {
            var matches = matcher.findAllMatches(leaf.getWholeText());
            if (!matches.isEmpty()) {
                created += annotate(leaf, matches);
            }
        }
        return created;
    }

    private int annotate(TextNode leaf, List<Match> matches) {
        TextNode current = leaf;
        int consumed = 0;
        int created = 0;

        for (var match : matches) {
            // offsets are relative to the original text; current holds what is left of it
            int relativeStart = match.start() - consumed;
            int available = current.getWholeText().length();
            if (relativeStart < 0 || relativeStart + match.length() > available) {
                logger.debug("Skipping match {} outside current node bounds (offset {}, length {})",
                             match, consumed, available);
                continue;
            }

            // split off the text before the match
            TextNode target = current;
            if (relativeStart > 0) {
                target = current.splitText(relativeStart);
                consumed += relativeStart;
            }

            // and the text after it
            TextNode rest = null;
            if (match.length() < target.getWholeText().length()) {
                rest = target.splitText(match.length());
            }
            consumed += match.length();

            var span = AnnotatedSpan.create(target.getWholeText(), match.replacement(),
                                            idProvider.generate(idPrefix), options);
            target.replaceWith(span.element());
            created++;

            if (rest == null) {
                break; // match ran to the end of the node
            }
            current = rest;
        }
        return created;
    }

    private boolean insideSpan(Node node, Element root) {
        for (var parent = node.parent(); parent != null && parent != root; parent = parent.parent()) {
            if (parent instanceof Element element && spanType.matches(element)) {
                return true;
            }
        }
        return spanType.matches(root);
    }

    /**
     * Replaces {@code span} with a plain text node holding its replacement. This is a single node
     * substitution; the matcher is not run here.
     *
     * @return the text node that took the span's place
     */
    public TextNode acceptReplacement(AnnotatedSpan span) {
        var replacement = new TextNode(span.replacement());
        logger.debug("Accepting replacement '{}' for '{}'", span.replacement(), span.text());
        span.element().replaceWith(replacement);
        return replacement;
    }

    /**
     * Outcome of one settle pass.
     */
    public record SettleResult(int reverted, int annotated) {
        public boolean changed() {
            return reverted > 0 || annotated > 0;
        }
    }
}
