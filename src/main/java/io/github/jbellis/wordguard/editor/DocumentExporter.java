package io.github.jbellis.wordguard.editor;

import org.jsoup.nodes.Document;

/**
 * Serializes a document for the outside world, without the editor's element keys.
 */
public final class DocumentExporter {
    private DocumentExporter() {
    }

    /**
     * @return the inner HTML of the body
     */
    public static String toHtml(Document document) {
        var copy = document.clone();
        copy.outputSettings().prettyPrint(false);
        copy.body().select("[" + DocumentEditor.NODE_KEY_ATTRIBUTE + "]")
            .removeAttr(DocumentEditor.NODE_KEY_ATTRIBUTE);
        return copy.body().html();
    }
}
