package io.github.jbellis.wordguard.editor;

/**
 * Sends the exported HTML to a {@link DocumentSink} after every committed update that changed it.
 */
public final class ContentChangePlugin implements Registration {
    private final Registration listener;
    private String lastExported;

    private ContentChangePlugin(DocumentEditor editor, DocumentSink sink) {
        this.lastExported = DocumentExporter.toHtml(editor.getEditorState().document());
        this.listener = editor.registerUpdateListener(event -> {
            var html = DocumentExporter.toHtml(event.current());
            if (!html.equals(lastExported)) {
                lastExported = html;
                sink.onContentChanged(html);
            }
        });
    }

    public static ContentChangePlugin install(DocumentEditor editor, DocumentSink sink) {
        return new ContentChangePlugin(editor, sink);
    }

    @Override
    public void close() {
        listener.close();
    }
}
