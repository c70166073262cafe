package com.triagedesk.support.desk.api;

import java.util.List;
import java.util.Map;

public record WorkloadStatsResponse(
        int unassigned,
        Map<String, Integer> by_team,
        List<AgentWorkloadItem> agent_workloads
) {

    public record AgentWorkloadItem(String agent_id, String name, String team, int active_tickets) {
    }
}
