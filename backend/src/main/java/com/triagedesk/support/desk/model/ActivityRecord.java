package com.triagedesk.support.desk.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Immutable audit entry; rows are only ever inserted.
 */
public record ActivityRecord(
        long id,
        String workItemId,
        String actorId,
        String action,
        JsonNode detail,
        Instant createdAt
) {
}
