package io.github.jbellis.wordguard.flex;

import com.vladsch.flexmark.util.data.DataKey;

/**
 * Option keys shared by the annotation components. Values are read from a flexmark
 * {@link com.vladsch.flexmark.util.data.DataHolder}; unset keys fall back to their defaults.
 */
public final class WordguardOptions {
    private WordguardOptions() {
    }

    /** Element tag used for annotated spans. */
    public static final DataKey<String> SPAN_TAG = new DataKey<>("SPAN_TAG", "span");

    /** CSS class put on annotated spans so the host can style them. */
    public static final DataKey<String> SPAN_CLASS = new DataKey<>("SPAN_CLASS", "foreign-word-highlight");

    /** Attribute holding the logical id of an annotated span. */
    public static final DataKey<String> SPAN_ID_ATTRIBUTE = new DataKey<>("SPAN_ID_ATTRIBUTE", "originid");

    public static final DataKey<String> SPAN_ID_PREFIX = new DataKey<>("SPAN_ID_PREFIX", "origin");

    /** Attribute carrying the unique id of a top-level block. */
    public static final DataKey<String> UNIQUE_ATTRIBUTE = new DataKey<>("UNIQUE_ATTRIBUTE", "data-unique");

    public static final DataKey<String> UNIQUE_PREFIX = new DataKey<>("UNIQUE_PREFIX", "unique");

    /** Classpath location of the bundled term list. */
    public static final DataKey<String> DICTIONARY_RESOURCE = new DataKey<>("DICTIONARY_RESOURCE", "/foreign-words.tsv");
}
