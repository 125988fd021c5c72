package io.github.jbellis.wordguard.trie;

import java.util.HashMap;
import java.util.Map;

/**
 * A node of the term trie. Nodes are mutated only while a {@link TrieMatcher.Builder} is inserting.
 */
final class TrieNode {
    private final Map<Character, TrieNode> children = new HashMap<>();
    private boolean terminal;
    private String term;
    private String replacement;

    TrieNode child(char c) {
        return children.get(c);
    }

    TrieNode childOrCreate(char c) {
        return children.computeIfAbsent(c, k -> new TrieNode());
    }

    boolean isTerminal() {
        return terminal;
    }

    String term() {
        return term;
    }

    String replacement() {
        return replacement;
    }

    void markTerminal(String term, String replacement) {
        this.terminal = true;
        this.term = term;
        this.replacement = replacement;
    }
}
