package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.repo.WorkItemRepository;
import org.springframework.stereotype.Component;

/**
 * Fresh per-call load snapshot. No caching: the numbers feed capacity decisions.
 */
@Component
public class LoadCalculator {

    private final WorkItemRepository workItemRepository;

    public LoadCalculator(WorkItemRepository workItemRepository) {
        this.workItemRepository = workItemRepository;
    }

    public AgentLoad load(String agentId) {
        if (agentId == null || agentId.isBlank()) throw new IllegalArgumentException("agent_id_required");
        return AgentLoad.of(agentId, workItemRepository.countActiveByPriority(agentId));
    }
}
