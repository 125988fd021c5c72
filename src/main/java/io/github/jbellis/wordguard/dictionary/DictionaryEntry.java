package io.github.jbellis.wordguard.dictionary;

/**
 * A source term to detect in free text and the replacement suggested for it.
 */
public record DictionaryEntry(String term, String replacement) {
    public DictionaryEntry {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("Dictionary term must not be empty");
        }
        if (replacement == null || replacement.isEmpty()) {
            throw new IllegalArgumentException("Replacement for '" + term + "' must not be empty");
        }
    }
}
