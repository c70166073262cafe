package com.triagedesk.support.desk.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Escalation ladder. {@link #rank()} is the only ordinal used for ladder arithmetic,
 * capacity lookups and SQL ordering.
 */
public enum Priority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == URGENT;
    }

    /**
     * @return the next rung up, or this priority when already at the top
     */
    public Priority next() {
        for (var p : values()) {
            if (p.rank == rank + 1) return p;
        }
        return this;
    }

    public static Priority fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("priority_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT);
        for (var p : values()) {
            if (p.name().equals(key)) return p;
        }
        throw new IllegalArgumentException("invalid_priority");
    }

    /**
     * SQL expression mapping a priority code column to {@link #rank()}.
     */
    public static String rankSql(String column) {
        return Arrays.stream(values())
                .map(p -> "when '" + p.code() + "' then " + p.rank)
                .collect(Collectors.joining(" ", "(case " + column + " ", " else 0 end)"));
    }
}
