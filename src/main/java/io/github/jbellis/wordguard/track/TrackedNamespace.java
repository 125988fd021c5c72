package io.github.jbellis.wordguard.track;

/**
 * A family of tracked words, identified by the attribute that carries their ids.
 *
 * @param name          short name used in log messages
 * @param attributeName attribute read from the element enclosing a tracked word
 */
public record TrackedNamespace(String name, String attributeName) {
    public static final TrackedNamespace ORIGIN = new TrackedNamespace("origin", "originid");
    public static final TrackedNamespace REFINE = new TrackedNamespace("refine", "refineid");

    public TrackedNamespace {
        if (attributeName == null || attributeName.isEmpty()) {
            throw new IllegalArgumentException("Tracked namespace needs an attribute name");
        }
    }
}
