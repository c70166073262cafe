package com.triagedesk.support.desk.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ActivityItem(
        long id,
        String work_item_id,
        String actor_id,
        String action,
        JsonNode detail,
        long created_at
) {
}
