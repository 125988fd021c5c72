package io.github.jbellis.wordguard.trie;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-pattern matcher over a character trie.
 * <p>
 * {@link #findAllMatches(String)} tries every start offset, keeps the longest term found from each
 * start and then resolves overlaps left to right. Worst case is O(n*k) for a text of length n and
 * a longest term of length k. Once built the trie is never modified, so a matcher can be shared
 * between threads without locking.
 */
public final class TrieMatcher {
    private static final Comparator<Match> BY_START_THEN_LONGEST =
            Comparator.comparingInt(Match::start).thenComparing(Comparator.comparingInt(Match::length).reversed());

    private final TrieNode root;
    private final int size;
    private final int longestTermLength;

    private TrieMatcher(TrieNode root, int size, int longestTermLength) {
        this.root = root;
        this.size = size;
        this.longestTermLength = longestTermLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds every non-overlapping longest match in {@code text}, ordered by start offset.
     */
    public List<Match> findAllMatches(String text) {
        if (text == null || text.isEmpty() || size == 0) {
            return List.of();
        }

        var candidates = new ArrayList<Match>();
        for (int i = 0; i < text.length(); i++) {
            TrieNode current = root;
            TrieNode best = null;
            int bestEnd = -1;
            int j = i;
            while (j < text.length()) {
                current = current.child(text.charAt(j));
                if (current == null) {
                    break;
                }
                j++;
                if (current.isTerminal()) {
                    best = current;
                    bestEnd = j;
                }
            }
            if (best != null) {
                candidates.add(new Match(i, bestEnd, best.term(), best.replacement()));
            }
        }

        return removeOverlapping(candidates);
    }

    private static List<Match> removeOverlapping(List<Match> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        candidates.sort(BY_START_THEN_LONGEST);

        var result = new ArrayList<Match>();
        int lastEnd = -1;
        for (var match : candidates) {
            if (match.start() >= lastEnd) {
                result.add(match);
                lastEnd = match.end();
            }
        }
        return result;
    }

    /**
     * True if {@code term} is exactly a dictionary term.
     */
    public boolean search(String term) {
        var node = descend(term);
        return node != null && node.isTerminal();
    }

    /**
     * The replacement for {@code term}, or null if it is not a dictionary term.
     */
    public String getReplacement(String term) {
        var node = descend(term);
        return node != null && node.isTerminal() ? node.replacement() : null;
    }

    private TrieNode descend(String term) {
        if (term == null) {
            return null;
        }
        TrieNode current = root;
        for (int i = 0; i < term.length() && current != null; i++) {
            current = current.child(term.charAt(i));
        }
        return current;
    }

    public int size() {
        return size;
    }

    public int longestTermLength() {
        return longestTermLength;
    }

    /**
     * Accumulates terms; a builder produces exactly one matcher.
     */
    public static final class Builder {
        private final TrieNode root = new TrieNode();
        private int size;
        private int longest;
        private boolean built;

        private Builder() {
        }

        /**
         * Adds a term. Inserting an existing term again overwrites its replacement.
         */
        public Builder insert(String term, String replacement) {
            if (built) {
                throw new IllegalStateException("Matcher already built");
            }
            if (term == null || term.isEmpty()) {
                throw new IllegalArgumentException("Cannot insert an empty term");
            }
            if (replacement == null) {
                throw new IllegalArgumentException("Replacement for '" + term + "' is null");
            }

            TrieNode current = root;
            for (int i = 0; i < term.length(); i++) {
                current = current.childOrCreate(term.charAt(i));
            }
            if (!current.isTerminal()) {
                size++;
                longest = Math.max(longest, term.length());
            }
            current.markTerminal(term, replacement);
            return this;
        }

        public TrieMatcher build() {
            if (built) {
                throw new IllegalStateException("Matcher already built");
            }
            built = true;
            return new TrieMatcher(root, size, longest);
        }
    }
}
