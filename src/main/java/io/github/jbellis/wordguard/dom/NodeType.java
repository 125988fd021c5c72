package io.github.jbellis.wordguard.dom;

import org.jsoup.nodes.Element;

/**
 * A kind of element the host knows how to handle. Implementations are discovered with
 * {@link java.util.ServiceLoader} and collected in a {@link NodeTypeRegistry}.
 */
public interface NodeType {
    /**
     * Unique name of the type, e.g. {@code foreign-word}.
     */
    String typeName();

    /**
     * True if {@code element} is an instance of this type.
     */
    boolean matches(Element element);

    /**
     * Text entities represent a single unit of text; editing their characters changes what they mean.
     */
    default boolean isTextEntity() {
        return false;
    }

    default boolean canInsertTextBefore() {
        return true;
    }

    default boolean canInsertTextAfter() {
        return true;
    }
}
