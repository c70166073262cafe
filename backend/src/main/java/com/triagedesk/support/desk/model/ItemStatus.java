package com.triagedesk.support.desk.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public enum ItemStatus {
    NEW,
    ASSIGNED,
    IN_PROGRESS,
    RESOLVED,
    CLOSED;

    private static final Set<ItemStatus> ACTIVE = EnumSet.of(NEW, ASSIGNED, IN_PROGRESS);

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Lifecycle only moves forward; skipping steps is allowed.
     */
    public boolean canMoveTo(ItemStatus target) {
        return target != null && target.ordinal() >= ordinal();
    }

    public static List<String> activeCodes() {
        return ACTIVE.stream().map(ItemStatus::code).toList();
    }

    public static ItemStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var s : values()) {
            if (s.name().equals(key)) return s;
        }
        throw new IllegalArgumentException("invalid_status");
    }
}
