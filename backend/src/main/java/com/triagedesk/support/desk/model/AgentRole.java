package com.triagedesk.support.desk.model;

import java.util.Locale;

public enum AgentRole {
    ADMIN,
    AGENT,
    VIEWER;

    /**
     * Only plain agents receive routed work; admins are the escalation fallback.
     */
    public boolean isRoutable() {
        return this == AGENT;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentRole fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role_required");
        }
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var v : values()) {
            if (v.name().equals(key)) return v;
        }
        throw new IllegalArgumentException("invalid_role");
    }
}
