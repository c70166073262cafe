package com.triagedesk.support.desk.model;

import java.util.Locale;

public enum Channel {
    EMAIL,
    CHAT,
    TWITTER,
    INSTAGRAM,
    FACEBOOK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Channel fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("channel_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var v : values()) {
            if (v.name().equals(key)) return v;
        }
        throw new IllegalArgumentException("invalid_channel");
    }
}
