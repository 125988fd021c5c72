package io.github.jbellis.wordguard.dictionary;

import io.github.jbellis.wordguard.trie.TrieMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping of source terms to replacement terms.
 * <p>
 * Terms are deduplicated case-insensitively; the first entry for a term wins. The dictionary owns
 * a single {@link TrieMatcher}, built on first use and shared by every caller afterwards.
 */
public final class Dictionary {
    private static final Logger logger = LogManager.getLogger(Dictionary.class);

    private final List<DictionaryEntry> entries;
    private final Map<String, DictionaryEntry> byFoldedTerm;
    private final String source;
    private volatile TrieMatcher matcher;

    private Dictionary(List<DictionaryEntry> entries, Map<String, DictionaryEntry> byFoldedTerm, String source) {
        this.entries = entries;
        this.byFoldedTerm = byFoldedTerm;
        this.source = source;
    }

    public static Dictionary of(List<DictionaryEntry> entries) {
        return build(entries, "<inline>");
    }

    public static Dictionary of(Map<String, String> termToReplacement) {
        var entries = new ArrayList<DictionaryEntry>();
        termToReplacement.forEach((term, replacement) -> entries.add(new DictionaryEntry(term, replacement)));
        return build(entries, "<inline>");
    }

    /**
     * Loads a dictionary from a UTF-8 tab-separated classpath resource.
     *
     * @param resourcePath absolute classpath location, e.g. {@code /foreign-words.tsv}
     * @return the loaded dictionary
     * @throws IllegalArgumentException if the resource is missing or contains a malformed line
     */
    public static Dictionary fromResource(String resourcePath) {
        InputStream in = Dictionary.class.getResourceAsStream(resourcePath);
        if (in == null) {
            throw new IllegalArgumentException("Dictionary resource not found: " + resourcePath);
        }
        try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromReader(reader, resourcePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dictionary resource " + resourcePath, e);
        }
    }

    /**
     * Parses {@code term<TAB>replacement} lines. Blank lines and lines starting with {@code #} are
     * ignored; a leading byte order mark is stripped.
     */
    public static Dictionary fromReader(Reader reader, String sourceName) throws IOException {
        var entries = new ArrayList<DictionaryEntry>();
        var br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        int lineNo = 0;
        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw;
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1);
            }
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }

            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw new IllegalArgumentException("Malformed dictionary line (no TAB) at %s:%d: %s"
                                                           .formatted(sourceName, lineNo, raw));
            }
            String term = line.substring(0, tab).strip();
            String replacement = line.substring(tab + 1).strip();
            if (term.isEmpty() || replacement.isEmpty()) {
                throw new IllegalArgumentException("Empty term or replacement at %s:%d: %s"
                                                           .formatted(sourceName, lineNo, raw));
            }
            entries.add(new DictionaryEntry(term, replacement));
        }
        return build(entries, sourceName);
    }

    private static Dictionary build(List<DictionaryEntry> candidates, String source) {
        var byFolded = new LinkedHashMap<String, DictionaryEntry>();
        for (var entry : candidates) {
            if (entry == null) {
                throw new IllegalArgumentException("Null dictionary entry in " + source);
            }
            var previous = byFolded.putIfAbsent(fold(entry.term()), entry);
            if (previous != null) {
                logger.warn("Dropping duplicate term '{}' in {} (already mapped to '{}')",
                            entry.term(), source, previous.replacement());
            }
        }
        var entries = List.copyOf(byFolded.values());
        logger.info("Loaded {} dictionary entries from {}", entries.size(), source);
        return new Dictionary(entries, Collections.unmodifiableMap(byFolded), source);
    }

    private static String fold(String term) {
        return term.toLowerCase(Locale.ROOT);
    }

    public List<DictionaryEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public String source() {
        return source;
    }

    /**
     * Finds the entry for a term, ignoring case.
     */
    public Optional<DictionaryEntry> lookup(String term) {
        if (term == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byFoldedTerm.get(fold(term)));
    }

    /**
     * Returns the matcher built from this dictionary. The same instance is returned on every call.
     */
    public TrieMatcher matcher() {
        var m = matcher;
        if (m == null) {
            synchronized (this) {
                m = matcher;
                if (m == null) {
                    var builder = TrieMatcher.builder();
                    entries.forEach(e -> builder.insert(e.term(), e.replacement()));
                    m = builder.build();
                    matcher = m;
                    logger.debug("Built matcher for {} ({} terms, longest {})",
                                 source, m.size(), m.longestTermLength());
                }
            }
        }
        return m;
    }
}
