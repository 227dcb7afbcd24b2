package de.bsommerfeld.stockroom.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Decides where the inventory lives when no {@code --db} is given.
 * <p>
 * {@link #PROD} uses the configured database file. {@link #TEST} points the
 * store at {@code :memory:}, so a test run or a dry run through the CLI
 * leaves the real inventory untouched.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    /** System property consulted first, e.g. {@code -Dstockroom.mode=test}. */
    public static final String PROPERTY = "stockroom.mode";
    /** Environment variable consulted when the property is absent. */
    public static final String ENV = "STOCKROOM_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Mode of the running process, read from {@link #PROPERTY} or {@link #ENV}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV));
    }

    /**
     * A blank property falls through to the environment value. Anything that
     * does not name a mode yields {@link #PROD}.
     */
    static ApplicationMode resolve(String propertyValue, String envValue) {
        String raw = isBlank(propertyValue) ? envValue : propertyValue;
        if (isBlank(raw)) {
            return PROD;
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        for (ApplicationMode mode : values()) {
            if (mode.name().equals(name)) {
                return mode;
            }
        }
        LOG.warn("Ignoring unknown {} '{}'; inventory stays on disk", PROPERTY, raw);
        return PROD;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Whether the store should be opened in memory. */
    public boolean usesInMemoryStore() {
        return this == TEST;
    }
}
