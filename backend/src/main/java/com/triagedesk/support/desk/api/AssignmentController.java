package com.triagedesk.support.desk.api;

import com.triagedesk.support.common.api.ApiResponse;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.repo.AgentRepository;
import com.triagedesk.support.desk.service.AssignmentService;
import com.triagedesk.support.desk.service.BatchAssignmentService;
import com.triagedesk.support.desk.service.EscalationScanService;
import com.triagedesk.support.desk.service.EscalationService;
import com.triagedesk.support.desk.service.WorkloadReportService;
import com.triagedesk.support.desk.service.exception.AgentNotFoundException;
import com.triagedesk.support.desk.service.exception.NoAgentAvailableException;
import com.triagedesk.support.desk.service.routing.LoadCalculator;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;

@RestController
@RequestMapping("/api/v1/assignment")
public class AssignmentController {

    private final AssignmentService assignmentService;
    private final BatchAssignmentService batchAssignmentService;
    private final EscalationService escalationService;
    private final EscalationScanService escalationScanService;
    private final WorkloadReportService workloadReportService;
    private final LoadCalculator loadCalculator;
    private final AgentRepository agentRepository;

    public AssignmentController(
            AssignmentService assignmentService,
            BatchAssignmentService batchAssignmentService,
            EscalationService escalationService,
            EscalationScanService escalationScanService,
            WorkloadReportService workloadReportService,
            LoadCalculator loadCalculator,
            AgentRepository agentRepository
    ) {
        this.assignmentService = assignmentService;
        this.batchAssignmentService = batchAssignmentService;
        this.escalationService = escalationService;
        this.escalationScanService = escalationScanService;
        this.workloadReportService = workloadReportService;
        this.loadCalculator = loadCalculator;
        this.agentRepository = agentRepository;
    }

    @PostMapping("/auto-assign/{id}")
    public ApiResponse<WorkItemSummary> autoAssign(@PathVariable("id") String workItemId) {
        var item = assignmentService.assign(workItemId, null, null);
        if (!item.isAssigned()) {
            throw new NoAgentAvailableException(workItemId);
        }
        return ApiResponse.ok(WorkItemSummary.from(item));
    }

    @PostMapping("/manual-assign")
    public ApiResponse<WorkItemSummary> manualAssign(@Valid @RequestBody ManualAssignRequest req) {
        var actor = req.actor_id() == null || req.actor_id().isBlank() ? null : req.actor_id().trim();
        var item = assignmentService.assign(req.work_item_id().trim(), req.agent_id().trim(), actor);
        return ApiResponse.ok(WorkItemSummary.from(item));
    }

    @PostMapping("/batch-assign")
    public ApiResponse<BatchAssignResponse> batchAssign(
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit
    ) {
        var assigned = batchAssignmentService.assignBatch(limit);
        return ApiResponse.ok(new BatchAssignResponse(
                assigned.size(),
                assigned.stream().map(WorkItemSummary::from).toList()
        ));
    }

    @GetMapping("/stats")
    public ApiResponse<WorkloadStatsResponse> stats() {
        var stats = workloadReportService.stats();
        var byTeam = new LinkedHashMap<String, Integer>();
        stats.byTeam().forEach((team, count) -> byTeam.put(team.code(), count));
        var agents = stats.agentWorkloads().stream()
                .map(r -> new WorkloadStatsResponse.AgentWorkloadItem(
                        r.agentId(), r.name(), r.team().code(), r.activeTickets()))
                .toList();
        return ApiResponse.ok(new WorkloadStatsResponse(stats.unassigned(), byTeam, agents));
    }

    @GetMapping("/agent-load/{agentId}")
    public ApiResponse<AgentLoadResponse> agentLoad(@PathVariable("agentId") String agentId) {
        var agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
        var load = loadCalculator.load(agent.id());
        var byPriority = new LinkedHashMap<String, Integer>();
        for (var p : Priority.values()) {
            byPriority.put(p.code(), load.count(p));
        }
        return ApiResponse.ok(new AgentLoadResponse(agent.id(), agent.team().code(), load.total(), byPriority));
    }

    @PostMapping("/escalate")
    public ApiResponse<WorkItemSummary> escalate(@Valid @RequestBody EscalateRequest req) {
        var target = req.target_agent_id() == null || req.target_agent_id().isBlank()
                ? null
                : req.target_agent_id().trim();
        var item = escalationService.escalate(req.work_item_id().trim(), req.reason().trim(), target);
        return ApiResponse.ok(WorkItemSummary.from(item));
    }

    @PostMapping("/check-escalations")
    public ApiResponse<ScanResultResponse> checkEscalations() {
        var result = escalationScanService.scan();
        var failures = result.failures().stream()
                .map(f -> new ScanResultResponse.FailureItem(f.workItemId(), f.trigger().reason(), f.error()))
                .toList();
        return ApiResponse.ok(new ScanResultResponse(
                result.urgentUnassigned(),
                result.slaBreach(),
                result.stuck(),
                failures,
                result.totalEscalated(),
                result.skipped()
        ));
    }

    @GetMapping("/at-risk")
    public ApiResponse<AtRiskResponse> atRisk() {
        var report = escalationScanService.atRisk();
        return ApiResponse.ok(new AtRiskResponse(
                report.approachingSla().stream()
                        .map(a -> new AtRiskResponse.ApproachingSlaItem(
                                a.workItemId(), a.subject(), a.priority(), a.hoursRemaining()))
                        .toList(),
                report.gettingStale().stream()
                        .map(s -> new AtRiskResponse.GettingStaleItem(
                                s.workItemId(), s.subject(), s.status(), s.priority(), s.hoursInStatus()))
                        .toList()
        ));
    }
}
