package io.github.jbellis.wordguard.span;

import io.github.jbellis.wordguard.dom.NodeType;
import org.jsoup.nodes.Element;

/**
 * Node type of annotated spans. Spans are text entities: text typed at their edges goes into a
 * sibling node rather than into the span.
 */
public class AnnotatedSpanType implements NodeType {
    public static final String TYPE_NAME = "foreign-word";

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public boolean matches(Element element) {
        return AnnotatedSpan.isAnnotatedSpan(element);
    }

    @Override
    public boolean isTextEntity() {
        return true;
    }

    @Override
    public boolean canInsertTextBefore() {
        return false;
    }

    @Override
    public boolean canInsertTextAfter() {
        return false;
    }
}
