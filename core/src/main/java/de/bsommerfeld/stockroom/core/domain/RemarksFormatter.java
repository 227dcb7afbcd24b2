package de.bsommerfeld.stockroom.core.domain;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Decides whether remarks text needs a fresh timestamp prefix and applies it.
 *
 * <p>
 * This is the only place that produces audit-formatted remarks. Every write
 * path that stores or appends remarks goes through {@link #format(String)}.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>blank text becomes {@code "[<ts>] "} (timestamp and one trailing
 * space)</li>
 * <li>text already starting with {@code [YYYY-MM-DD HH:MM]} is returned
 * unchanged, so formatting is idempotent</li>
 * <li>anything else becomes {@code "[<ts>] <trimmed text>"}</li>
 * </ul>
 *
 * The timestamp is taken from the injected {@link Clock} in the clock's zone,
 * so tests can pin it with {@link Clock#fixed}.
 */
public final class RemarksFormatter {

    /** Layout of the bracketed timestamp, 24-hour clock. */
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final Pattern STAMP_PREFIX = Pattern.compile("^\\[\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}]");

    private final Clock clock;

    public RemarksFormatter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Formats {@code current} as a single audit entry.
     *
     * @param current raw remarks text, may be {@code null}
     * @return the audit-formatted text, never {@code null}
     */
    public String format(String current) {
        String trimmed = current == null ? "" : current.trim();
        if (trimmed.isEmpty()) {
            return "[" + timestamp() + "] ";
        }
        if (isStamped(trimmed)) {
            return current;
        }
        return "[" + timestamp() + "] " + trimmed;
    }

    /** Current time rendered with {@link #TIMESTAMP}. */
    public String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    /**
     * Returns {@code true} when {@code text} begins with a bracketed
     * {@code [YYYY-MM-DD HH:MM]} timestamp. Leading whitespace is ignored.
     */
    public static boolean isStamped(String text) {
        return text != null && STAMP_PREFIX.matcher(text.stripLeading()).find();
    }
}
