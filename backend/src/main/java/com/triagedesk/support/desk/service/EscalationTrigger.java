package com.triagedesk.support.desk.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scan triggers, in the order the scan evaluates them. The reason string is what lands in the activity log.
 */
public enum EscalationTrigger {
    UNASSIGNED_URGENT("unassigned-urgent"),
    SLA_BREACH("sla-breach"),
    STUCK("stuck");

    private final String reason;

    EscalationTrigger(String reason) {
        this.reason = reason;
    }

    @JsonValue
    public String reason() {
        return reason;
    }
}
