package io.github.jbellis.wordguard.flex;

import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Turns HTML or Markdown content into a document tree.
 * <p>
 * Spans already marked with {@code data-foreign-word} in the HTML are kept as annotated spans;
 * elements carrying {@code originid} or {@code refineid} become tracked words.
 */
public class DocumentLoader {
    private static final Logger logger = LogManager.getLogger(DocumentLoader.class);

    private final Parser parser;
    private final HtmlRenderer renderer;

    public DocumentLoader() {
        this(new MutableDataSet());
    }

    public DocumentLoader(DataHolder baseOptions) {
        MutableDataSet options = new MutableDataSet(baseOptions)
            .set(Parser.EXTENSIONS, List.of(TablesExtension.create()))
            .set(HtmlRenderer.SOFT_BREAK, "<br />\n")
            .set(HtmlRenderer.ESCAPE_HTML, true);

        parser = Parser.builder(options).build();
        renderer = HtmlRenderer.builder(options).build();
    }

    public Document fromHtml(String html) {
        var document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        logger.debug("Loaded HTML document with {} blocks", document.body().childNodeSize());
        return document;
    }

    /**
     * Renders Markdown to HTML and loads the result. Raw HTML in the Markdown is escaped.
     */
    public Document fromMarkdown(String markdown) {
        var html = renderer.render(parser.parse(markdown));
        return fromHtml(html);
    }
}
