package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of one agent's active items (NEW, ASSIGNED, IN_PROGRESS).
 */
public record AgentLoad(String agentId, int total, Map<Priority, Integer> byPriority) {

    public AgentLoad {
        var copy = new EnumMap<Priority, Integer>(Priority.class);
        for (var p : Priority.values()) {
            copy.put(p, byPriority == null ? 0 : byPriority.getOrDefault(p, 0));
        }
        byPriority = Collections.unmodifiableMap(copy);
    }

    public int count(Priority priority) {
        return byPriority.get(priority);
    }

    public static AgentLoad of(String agentId, Map<Priority, Integer> byPriority) {
        int total = byPriority == null ? 0 : byPriority.values().stream().mapToInt(Integer::intValue).sum();
        return new AgentLoad(agentId, total, byPriority);
    }
}
