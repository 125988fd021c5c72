package io.github.jbellis.wordguard.dictionary;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryTest {

    @Test
    void duplicateTermsKeepFirstEntryIgnoringCase() {
        var dictionary = Dictionary.of(List.of(
                new DictionaryEntry("Coffee", "brew"),
                new DictionaryEntry("tea", "infusion"),
                new DictionaryEntry("coffee", "java")));

        assertEquals(2, dictionary.size());
        assertEquals("brew", dictionary.lookup("COFFEE").orElseThrow().replacement());
        assertEquals("Coffee", dictionary.entries().get(0).term());
        assertEquals("tea", dictionary.entries().get(1).term());
    }

    @Test
    void mapFactoryKeepsInsertionOrder() {
        var map = new LinkedHashMap<String, String>();
        map.put("b", "2");
        map.put("a", "1");

        var dictionary = Dictionary.of(map);

        assertEquals(List.of(new DictionaryEntry("b", "2"), new DictionaryEntry("a", "1")), dictionary.entries());
        assertEquals("<inline>", dictionary.source());
    }

    @Test
    void entriesRejectEmptySides() {
        assertThrows(IllegalArgumentException.class, () -> new DictionaryEntry("", "x"));
        assertThrows(IllegalArgumentException.class, () -> new DictionaryEntry("x", ""));
    }

    @Test
    void lookupMissesUnknownAndNull() {
        var dictionary = Dictionary.of(List.of(new DictionaryEntry("coffee", "brew")));

        assertTrue(dictionary.lookup("tea").isEmpty());
        assertTrue(dictionary.lookup(null).isEmpty());
    }

    @Test
    void parsesTabSeparatedLines() throws IOException {
        var tsv = "\uFEFF# header\n"
                  + "\n"
                  + "coffee\tbrew\n"
                  + "  tea \t infusion \n"
                  + "# trailing comment\n";

        var dictionary = Dictionary.fromReader(new StringReader(tsv), "test.tsv");

        assertEquals(2, dictionary.size());
        assertEquals("infusion", dictionary.lookup("tea").orElseThrow().replacement());
        assertEquals("test.tsv", dictionary.source());
    }

    @Test
    void malformedLineReportsSourceAndLine() {
        var tsv = "coffee\tbrew\nno tab here\n";

        var e = assertThrows(IllegalArgumentException.class,
                             () -> Dictionary.fromReader(new StringReader(tsv), "bad.tsv"));
        assertTrue(e.getMessage().contains("bad.tsv:2"), e.getMessage());
    }

    @Test
    void emptyReplacementIsMalformed() {
        var tsv = "coffee\t  \n";

        assertThrows(IllegalArgumentException.class,
                     () -> Dictionary.fromReader(new StringReader(tsv), "bad.tsv"));
    }

    @Test
    void loadsBundledResource() {
        var dictionary = Dictionary.fromResource("/foreign-words.tsv");

        assertEquals(30, dictionary.size());
        assertEquals("가배", dictionary.lookup("커피").orElseThrow().replacement());
        assertEquals("전산기", dictionary.matcher().getReplacement("컴퓨터"));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalArgumentException.class, () -> Dictionary.fromResource("/no-such-dictionary.tsv"));
    }

    @Test
    void matcherIsBuiltOnce() {
        var dictionary = Dictionary.of(List.of(new DictionaryEntry("coffee", "brew")));

        var first = dictionary.matcher();

        assertSame(first, dictionary.matcher());
        assertEquals(1, first.size());
        assertTrue(first.search("coffee"));
    }
}
