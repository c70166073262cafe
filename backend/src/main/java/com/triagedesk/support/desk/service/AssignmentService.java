package com.triagedesk.support.desk.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ActivityRepository;
import com.triagedesk.support.desk.repo.AgentRepository;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.exception.AgentNotFoundException;
import com.triagedesk.support.desk.service.exception.WorkItemNotFoundException;
import com.triagedesk.support.desk.service.routing.AgentSelector;
import com.triagedesk.support.desk.service.routing.TeamResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    public static final String ACTION_AUTO = "assigned";
    public static final String ACTION_MANUAL = "manually_assigned";

    private final WorkItemRepository workItemRepository;
    private final AgentRepository agentRepository;
    private final ActivityRepository activityRepository;
    private final TeamResolver teamResolver;
    private final AgentSelector agentSelector;
    private final Clock clock;

    private final Counter autoAssigned;
    private final Counter manualAssigned;
    private final Counter noAgentAvailable;

    public AssignmentService(
            WorkItemRepository workItemRepository,
            AgentRepository agentRepository,
            ActivityRepository activityRepository,
            TeamResolver teamResolver,
            AgentSelector agentSelector,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.workItemRepository = workItemRepository;
        this.agentRepository = agentRepository;
        this.activityRepository = activityRepository;
        this.teamResolver = teamResolver;
        this.agentSelector = agentSelector;
        this.clock = clock;

        // Low-cardinality metrics: never tag by agent or work item.
        this.autoAssigned = Counter.builder("triagedesk.assignment.assigned")
                .tag("method", "auto")
                .description("Work items assigned by the router")
                .register(meterRegistry);
        this.manualAssigned = Counter.builder("triagedesk.assignment.assigned")
                .tag("method", "manual")
                .description("Work items assigned explicitly")
                .register(meterRegistry);
        this.noAgentAvailable = Counter.builder("triagedesk.assignment.no_agent")
                .description("Auto-assignment attempts that found no eligible agent")
                .register(meterRegistry);
    }

    /**
     * Assign a work item.
     *
     * With an explicit {@code agentId} this is a manual override: team routing and every capacity check are
     * skipped. Without one the item is routed to its team's least-loaded agent; an item that already has an
     * assignee is returned as is, and an item nobody can take is returned unassigned and untouched.
     *
     * The item row stays locked for the whole read-modify-write, so concurrent callers on one item serialize
     * and later callers observe the earlier outcome.
     */
    @Transactional
    public WorkItem assign(String workItemId, String agentId, String actorId) {
        var item = workItemRepository.lockById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));

        boolean manual = agentId != null && !agentId.isBlank();
        String targetAgentId;
        if (manual) {
            targetAgentId = agentRepository.findById(agentId)
                    .orElseThrow(() -> new AgentNotFoundException(agentId))
                    .id();
        } else {
            if (item.isAssigned()) {
                log.debug("auto_assign_skipped workItemId={} assigneeId={}", item.id(), item.assigneeId());
                return item;
            }
            var team = teamResolver.resolve(item);
            var picked = agentSelector.select(team, item.priority());
            if (picked.isEmpty()) {
                noAgentAvailable.increment();
                log.info("auto_assign_no_agent workItemId={} team={} priority={}",
                        item.id(), team.code(), item.priority().code());
                return item;
            }
            targetAgentId = picked.get().id();
        }

        Instant now = Instant.now(clock);
        var status = item.status() == ItemStatus.NEW ? ItemStatus.ASSIGNED : item.status();
        workItemRepository.updateAssignment(item.id(), targetAgentId, now, status);

        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("old_assignee_id", item.assigneeId());
        detail.put("new_assignee_id", targetAgentId);
        detail.put("method", manual ? "manual" : "auto");
        activityRepository.append(item.id(), actorId, manual ? ACTION_MANUAL : ACTION_AUTO, detail, now);

        (manual ? manualAssigned : autoAssigned).increment();
        log.info("work_item_assigned workItemId={} from={} to={} method={}",
                item.id(), item.assigneeId(), targetAgentId, manual ? "manual" : "auto");

        return workItemRepository.findById(item.id())
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
    }
}
