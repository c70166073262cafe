package com.triagedesk.support.desk.model;

import java.util.Locale;

public enum Category {
    QUESTION,
    REQUEST,
    COMPLAINT,
    FEEDBACK,
    BUG_REPORT,
    GENERAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Category fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("category_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var v : values()) {
            if (v.name().equals(key)) return v;
        }
        throw new IllegalArgumentException("invalid_category");
    }
}
