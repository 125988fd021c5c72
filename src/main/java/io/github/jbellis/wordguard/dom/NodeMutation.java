package io.github.jbellis.wordguard.dom;

/**
 * Lifecycle event of one element across a committed update.
 */
public enum NodeMutation {
    CREATED,
    UPDATED,
    DESTROYED
}
