package io.github.jbellis.wordguard.flex;

import com.vladsch.flexmark.util.data.DataKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Random;

/**
 * Generates identifiers of the form {@code prefix-timestampMillis-suffix}.
 * 
 * The suffix is nine random base-36 characters. Ids are not guaranteed unique on their own;
 * callers that need uniqueness within a scope check against the ids they have already handed out.
 */
public class IdProvider {
    private static final Logger logger = LogManager.getLogger(IdProvider.class);

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    static final int SUFFIX_LENGTH = 9;

    /**
     * DataKey for storing/retrieving the IdProvider from the options.
     */
    public static final DataKey<IdProvider> ID_PROVIDER = new DataKey<>("ID_PROVIDER", new IdProvider());

    private final Clock clock;
    private final Random random;

    public IdProvider() {
        this(Clock.systemUTC(), new Random());
    }

    public IdProvider(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generates a fresh id.
     *
     * @param prefix the leading segment, e.g. {@code unique}
     * @return {@code prefix + "-" + millis + "-" + suffix}
     */
    public String generate(String prefix) {
        var sb = new StringBuilder(prefix.length() + 24);
        sb.append(prefix).append('-').append(clock.millis()).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        var id = sb.toString();
        logger.trace("Generated id {}", id);
        return id;
    }
}
