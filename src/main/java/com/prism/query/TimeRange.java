package com.prism.query;

import java.time.LocalDateTime;

/**
 * Represents an inclusive time range for query filtering. Either bound may be open (null).
 */
public class TimeRange {
    private final LocalDateTime from;
    private final LocalDateTime to;

    public TimeRange(LocalDateTime from, LocalDateTime to) {
        this.from = from;
        this.to = to;
    }

    public LocalDateTime getFrom() {
        return from;
    }

    public LocalDateTime getTo() {
        return to;
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + "]";
    }
}
