package io.github.jbellis.wordguard.trie;

import io.github.jbellis.wordguard.TestUtil;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the TrieMatcher.
 */
class TrieMatcherTest {

    @Test
    void longestMatchAtStartWins() {
        var matcher = TestUtil.matcher("a", "x", "ab", "y");

        var matches = matcher.findAllMatches("ab");

        assertEquals(List.of(new Match(0, 2, "ab", "y")), matches);
    }

    @Test
    void earlierStartSuppressesOverlappingCandidate() {
        var matcher = TestUtil.matcher("bb", "1", "bc", "2");

        var matches = matcher.findAllMatches("abbc");

        assertEquals(1, matches.size());
        assertEquals(new Match(1, 3, "bb", "1"), matches.get(0));
    }

    @Test
    void findsEveryOccurrenceInOrder() {
        var matcher = TestUtil.matcher("coffee", "brew", "tea", "infusion");

        var matches = matcher.findAllMatches("tea or coffee, then more coffee");

        assertEquals(3, matches.size());
        assertEquals(new Match(0, 3, "tea", "infusion"), matches.get(0));
        assertEquals(new Match(7, 13, "coffee", "brew"), matches.get(1));
        assertEquals(new Match(25, 31, "coffee", "brew"), matches.get(2));
    }

    @Test
    void matchesInsideWordsAndAdjacentTerms() {
        var matcher = TestUtil.matcher("커피", "가배", "게임", "놀이");

        var matches = matcher.findAllMatches("커피게임을 했다");

        assertEquals(2, matches.size());
        assertEquals(0, matches.get(0).start());
        assertEquals(2, matches.get(0).end());
        assertEquals(2, matches.get(1).start());
        assertEquals("놀이", matches.get(1).replacement());
    }

    @Test
    void longerTermStartingLaterLosesToEarlierShorterOne() {
        var matcher = TestUtil.matcher("ab", "1", "bcd", "2");

        var matches = matcher.findAllMatches("abcd");

        assertEquals(List.of(new Match(0, 2, "ab", "1")), matches);
    }

    @Test
    void noTermsMeansNoMatches() {
        var matcher = TestUtil.matcher("coffee", "brew");

        assertTrue(matcher.findAllMatches("nothing to see here").isEmpty());
        assertTrue(matcher.findAllMatches("").isEmpty());
        assertTrue(matcher.findAllMatches(null).isEmpty());
        assertTrue(TrieMatcher.builder().build().findAllMatches("coffee").isEmpty());
    }

    @Test
    void matchingIsCaseSensitive() {
        var matcher = TestUtil.matcher("Coffee", "brew");

        assertTrue(matcher.findAllMatches("coffee").isEmpty());
        assertEquals(1, matcher.findAllMatches("Coffee").size());
    }

    @Test
    void searchRequiresExactTerm() {
        var matcher = TestUtil.matcher("coffee", "brew");

        assertTrue(matcher.search("coffee"));
        assertFalse(matcher.search("coff"));
        assertFalse(matcher.search("coffees"));
        assertFalse(matcher.search(""));
        assertFalse(matcher.search(null));
    }

    @Test
    void getReplacementReturnsNullOnMiss() {
        var matcher = TestUtil.matcher("coffee", "brew", "co", "together");

        assertEquals("brew", matcher.getReplacement("coffee"));
        assertEquals("together", matcher.getReplacement("co"));
        assertNull(matcher.getReplacement("cof"));
        assertNull(matcher.getReplacement("tea"));
    }

    @Test
    void reinsertingTermOverwritesReplacement() {
        var matcher = TrieMatcher.builder()
                                 .insert("coffee", "brew")
                                 .insert("coffee", "java")
                                 .build();

        assertEquals("java", matcher.getReplacement("coffee"));
        assertEquals(1, matcher.size());
        assertEquals(6, matcher.longestTermLength());
    }

    @Test
    void builderRejectsEmptyTermsAndReuse() {
        var builder = TrieMatcher.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.insert("", "x"));
        assertThrows(IllegalArgumentException.class, () -> builder.insert(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> builder.insert("a", null));

        builder.insert("a", "x").build();
        assertThrows(IllegalStateException.class, () -> builder.insert("b", "y"));
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void matchesNeverOverlap() {
        var random = new Random(7);
        var alphabet = "abc";
        for (int round = 0; round < 200; round++) {
            var builder = TrieMatcher.builder();
            for (int t = 0; t < 6; t++) {
                builder.insert(randomString(random, alphabet, 1 + random.nextInt(4)), "r" + t);
            }
            var matcher = builder.build();
            var text = randomString(random, alphabet, 40);

            var matches = matcher.findAllMatches(text);

            for (int i = 0; i + 1 < matches.size(); i++) {
                var current = matches.get(i);
                var next = matches.get(i + 1);
                assertTrue(current.end() <= next.start(), "overlap in '" + text + "': " + matches);
                assertFalse(current.overlaps(next));
            }
            for (var match : matches) {
                assertEquals(match.term(), text.substring(match.start(), match.end()));
            }
        }
    }

    private static String randomString(Random random, String alphabet, int length) {
        var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
