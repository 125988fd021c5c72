package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.span.AnnotatedSpan;
import io.github.jbellis.wordguard.span.SpanTransformEngine;
import io.github.jbellis.wordguard.trie.TrieMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps dictionary terms in the document wrapped in annotated spans and lets the user swap a span
 * for its replacement.
 */
public final class ForeignWordPlugin implements Registration {
    private static final Logger logger = LogManager.getLogger(ForeignWordPlugin.class);

    private final DocumentEditor editor;
    private final SpanTransformEngine engine;
    private final Registration transform;

    private ForeignWordPlugin(DocumentEditor editor, SpanTransformEngine engine) {
        this.editor = editor;
        this.engine = engine;
        this.transform = editor.registerTransform(document -> engine.settle(document.body()).changed());
    }

    /**
     * Installs the span transform on {@code editor}.
     *
     * @throws IllegalStateException if the editor's node types do not include annotated spans
     */
    public static ForeignWordPlugin install(DocumentEditor editor, TrieMatcher matcher) {
        var engine = SpanTransformEngine.attach(editor.nodeTypes(), matcher, editor.options());
        return new ForeignWordPlugin(editor, engine);
    }

    public SpanTransformEngine engine() {
        return engine;
    }

    /**
     * Handles activation of the span with element key {@code nodeKey}: if {@code confirmation}
     * accepts, the span is replaced by its replacement text in a new update.
     *
     * @return true if the replacement was applied
     */
    public boolean activate(String nodeKey, ReplacementConfirmation confirmation) {
        boolean[] applied = {false};
        editor.update(document -> {
            var element = editor.elementByKey(nodeKey);
            if (element == null || !AnnotatedSpan.isAnnotatedSpan(element)) {
                logger.debug("No annotated span with key {}", nodeKey);
                return;
            }
            var span = AnnotatedSpan.wrap(element, editor.options());
            if (confirmation.confirm(span.text(), span.replacement())) {
                engine.acceptReplacement(span);
                applied[0] = true;
            }
        });
        return applied[0];
    }

    @Override
    public void close() {
        transform.close();
    }

    /**
     * Asks the user whether {@code original} should become {@code replacement}.
     */
    @FunctionalInterface
    public interface ReplacementConfirmation {
        boolean confirm(String original, String replacement);
    }
}
