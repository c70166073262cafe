package com.triagedesk.support.desk.model;

import java.util.Locale;

public enum Team {
    SUPPORT,
    ENGINEERING,
    SALES,
    FINANCE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Team fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("team_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var v : values()) {
            if (v.name().equals(key)) return v;
        }
        throw new IllegalArgumentException("invalid_team");
    }
}
