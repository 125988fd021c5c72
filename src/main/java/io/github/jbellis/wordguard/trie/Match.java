package io.github.jbellis.wordguard.trie;

/**
 * One dictionary hit inside a text string. {@code end} is exclusive.
 */
public record Match(int start, int end, String term, String replacement) {
    public int length() {
        return end - start;
    }

    boolean overlaps(Match other) {
        return start < other.end && other.start < end;
    }
}
