package com.triagedesk.support.desk.api;

import java.util.Map;

public record AgentLoadResponse(
        String agent_id,
        String team,
        int total,
        Map<String, Integer> by_priority
) {
}
