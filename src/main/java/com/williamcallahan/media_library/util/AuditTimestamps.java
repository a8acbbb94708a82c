package com.williamcallahan.media_library.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Produces the {@code createdDate} / {@code lastModifiedDate} values written by the repositories.
 *
 * <p>Values are truncated to microseconds, the finest precision PostgreSQL and H2 keep for
 * {@code TIMESTAMP} columns, so a stamped entity compares equal to the row read back.</p>
 */
public final class AuditTimestamps {

    static final ChronoUnit PRECISION = ChronoUnit.MICROS;

    private AuditTimestamps() {
    }

    public static LocalDateTime now() {
        return now(Clock.systemDefaultZone());
    }

    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(PRECISION);
    }

    /**
     * Next modification stamp for a row whose stored stamp is {@code previous}.
     * Always strictly after {@code previous}, even when the clock has not advanced
     * (or has gone backwards) since the last write.
     *
     * @param previous stored {@code lastModifiedDate}, may be {@code null}
     * @param clock    clock to read
     * @return a stamp strictly after {@code previous}
     */
    public static LocalDateTime nextModifiedDate(LocalDateTime previous, Clock clock) {
        LocalDateTime candidate = now(clock);
        if (previous == null || candidate.isAfter(previous)) {
            return candidate;
        }
        return previous.truncatedTo(PRECISION).plus(1, PRECISION);
    }

    public static LocalDateTime nextModifiedDate(LocalDateTime previous) {
        return nextModifiedDate(previous, Clock.systemDefaultZone());
    }
}
