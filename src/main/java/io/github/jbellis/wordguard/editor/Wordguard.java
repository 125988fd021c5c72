package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.dictionary.Dictionary;
import io.github.jbellis.wordguard.flex.WordguardOptions;
import io.github.jbellis.wordguard.track.TrackedNamespace;
import io.github.jbellis.wordguard.track.WordDeletionSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Installs the full set of annotation plugins on an editor.
 * <p>
 * Origin word deletions and content changes go to the {@link DocumentSink}; refined word
 * deletions go to a separate sink, which by default only logs them. Installing runs one update so
 * that the loaded document is annotated right away.
 */
public final class Wordguard implements Registration {
    private static final Logger logger = LogManager.getLogger(Wordguard.class);

    private final ForeignWordPlugin foreignWords;
    private final List<Registration> registrations;

    private Wordguard(ForeignWordPlugin foreignWords, List<Registration> registrations) {
        this.foreignWords = foreignWords;
        this.registrations = registrations;
    }

    /**
     * Installs with the dictionary resource named by {@link WordguardOptions#DICTIONARY_RESOURCE}.
     */
    public static Wordguard install(DocumentEditor editor, DocumentSink sink) {
        var dictionary = Dictionary.fromResource(WordguardOptions.DICTIONARY_RESOURCE.get(editor.options()));
        return install(editor, dictionary, sink);
    }

    public static Wordguard install(DocumentEditor editor, Dictionary dictionary, DocumentSink sink) {
        return install(editor, dictionary, sink, id -> logger.info("Refined word deleted: {}", id));
    }

    public static Wordguard install(DocumentEditor editor, Dictionary dictionary, DocumentSink sink,
                                    WordDeletionSink refineSink) {
        var foreignWords = ForeignWordPlugin.install(editor, dictionary.matcher());
        var registrations = List.<Registration>of(
                foreignWords,
                UniqueAttributePlugin.install(editor),
                TrackedWordPlugin.install(editor, TrackedNamespace.ORIGIN, sink),
                TrackedWordPlugin.install(editor, TrackedNamespace.REFINE, refineSink),
                ContentChangePlugin.install(editor, sink));
        logger.info("Installed {} plugins with dictionary {}", registrations.size(), dictionary.source());

        // content loaded before install has not been through the transforms yet
        editor.update(document -> { });
        return new Wordguard(foreignWords, registrations);
    }

    public ForeignWordPlugin foreignWords() {
        return foreignWords;
    }

    @Override
    public void close() {
        registrations.forEach(Registration::close);
    }
}
