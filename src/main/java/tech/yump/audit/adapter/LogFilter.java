package tech.yump.audit.adapter;

import java.time.Instant;

/**
 * Optional time range, paging and ordering applied by the {@code getBy*} and {@code countBy*} lookups.
 * Paging and ordering are ignored when counting.
 *
 * @param after     inclusive lower time bound, or {@code null}
 * @param before    inclusive upper time bound, or {@code null}
 * @param limit     page size
 * @param offset    rows to skip
 * @param ascending oldest first when {@code true}
 */
public record LogFilter(Instant after, Instant before, int limit, int offset, boolean ascending) {

    public static final int DEFAULT_LIMIT = 25;

    public static LogFilter defaults() {
        return new LogFilter(null, null, DEFAULT_LIMIT, 0, false);
    }

    public static LogFilter page(int limit, int offset) {
        return new LogFilter(null, null, limit, offset, false);
    }

    public LogFilter between(Instant after, Instant before) {
        return new LogFilter(after, before, limit, offset, ascending);
    }

    public LogFilter oldestFirst() {
        return new LogFilter(after, before, limit, offset, true);
    }
}
