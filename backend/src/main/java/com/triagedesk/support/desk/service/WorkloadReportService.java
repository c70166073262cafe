package com.triagedesk.support.desk.service;

import com.triagedesk.support.desk.model.Team;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class WorkloadReportService {

    public record WorkloadStats(
            int unassigned,
            Map<Team, Integer> byTeam,
            List<WorkItemRepository.AgentWorkloadRow> agentWorkloads
    ) {
    }

    private final WorkItemRepository workItemRepository;

    public WorkloadReportService(WorkItemRepository workItemRepository) {
        this.workItemRepository = workItemRepository;
    }

    public WorkloadStats stats() {
        return new WorkloadStats(
                workItemRepository.countUnassignedNew(),
                workItemRepository.countWorkingByTeam(),
                workItemRepository.listAgentWorkloads()
        );
    }
}
