package io.github.jbellis.wordguard.dom;

/**
 * String attributes of a document node, keyed by name.
 */
public interface AttributeStore {
    /**
     * @return the attribute value, or null when the attribute is absent or empty
     */
    String get(String name);

    void set(String name, String value);
}
