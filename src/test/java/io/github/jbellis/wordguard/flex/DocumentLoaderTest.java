package io.github.jbellis.wordguard.flex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentLoaderTest {
    private final DocumentLoader loader = new DocumentLoader();

    @Test
    void markdownBecomesBlocks() {
        var document = loader.fromMarkdown("""
                # Title

                I like *coffee*.

                | a | b |
                |---|---|
                | 1 | 2 |
                """);

        var blocks = document.body().children();
        assertEquals("h1", blocks.get(0).normalName());
        assertEquals("p", blocks.get(1).normalName());
        assertEquals("table", blocks.get(2).normalName());
        assertEquals("coffee", document.selectFirst("em").text());
        assertFalse(document.outputSettings().prettyPrint());
    }

    @Test
    void rawHtmlInMarkdownIsEscaped() {
        var document = loader.fromMarkdown("hello <b>there</b>");

        assertTrue(document.select("b").isEmpty());
        assertTrue(document.body().text().contains("<b>there</b>"));
    }

    @Test
    void htmlKeepsExistingSpans() {
        var document = loader.fromHtml("<p>I like <span data-foreign-word=\"true\" originid=\"o1\">coffee</span></p>");

        var span = document.selectFirst("[data-foreign-word]");
        assertNotNull(span);
        assertEquals("o1", span.attr("originid"));
    }
}
