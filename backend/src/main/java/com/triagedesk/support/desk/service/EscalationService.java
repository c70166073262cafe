package com.triagedesk.support.desk.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.triagedesk.support.desk.model.Agent;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ActivityRepository;
import com.triagedesk.support.desk.repo.AgentRepository;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.exception.InvalidTargetException;
import com.triagedesk.support.desk.service.exception.NoAdminAvailableException;
import com.triagedesk.support.desk.service.exception.WorkItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    public static final String ACTION = "escalated";

    private final WorkItemRepository workItemRepository;
    private final AgentRepository agentRepository;
    private final ActivityRepository activityRepository;
    private final Clock clock;

    public EscalationService(
            WorkItemRepository workItemRepository,
            AgentRepository agentRepository,
            ActivityRepository activityRepository,
            Clock clock
    ) {
        this.workItemRepository = workItemRepository;
        this.agentRepository = agentRepository;
        this.activityRepository = activityRepository;
        this.clock = clock;
    }

    /**
     * Move a work item one rung up the priority ladder and make sure someone owns it.
     *
     * The assignee becomes {@code targetAgentId} when given; otherwise an existing assignee is kept, and an
     * unowned item goes to the first active admin. URGENT items stay URGENT but the escalation is still
     * recorded. Every check runs before the first write: a rejected call changes nothing.
     *
     * @throws WorkItemNotFoundException  unknown work item
     * @throws InvalidTargetException     {@code targetAgentId} is not an existing agent
     * @throws NoAdminAvailableException  the item is unowned and there is no active admin
     */
    @Transactional
    public WorkItem escalate(String workItemId, String reason, String targetAgentId) {
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException("reason_required");

        var item = workItemRepository.lockById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
        return apply(item, reason, targetAgentId);
    }

    /**
     * Escalate only if {@code stillDue} holds for the row as it stands once locked. Used by scans, whose
     * candidate lists may be outdated by the time each item is reached.
     *
     * @return the escalated item, or empty when the condition no longer holds and nothing was written
     */
    @Transactional
    public Optional<WorkItem> escalateIf(String workItemId, String reason, Predicate<WorkItem> stillDue) {
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException("reason_required");

        var item = workItemRepository.lockById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
        if (!stillDue.test(item)) {
            log.debug("escalation_skipped workItemId={} reason={} status={} priority={}",
                    item.id(), reason, item.status().code(), item.priority().code());
            return Optional.empty();
        }
        return Optional.of(apply(item, reason, null));
    }

    private WorkItem apply(WorkItem item, String reason, String targetAgentId) {
        String newAssigneeId;
        if (targetAgentId != null && !targetAgentId.isBlank()) {
            newAssigneeId = agentRepository.findById(targetAgentId)
                    .map(Agent::id)
                    .orElseThrow(() -> new InvalidTargetException(targetAgentId));
        } else if (item.isAssigned()) {
            newAssigneeId = item.assigneeId();
        } else {
            newAssigneeId = agentRepository.findFirstActiveAdmin()
                    .map(Agent::id)
                    .orElseThrow(() -> new NoAdminAvailableException(item.id()));
        }

        var oldPriority = item.priority();
        var newPriority = oldPriority.next();
        workItemRepository.updateEscalation(item.id(), newPriority, newAssigneeId);

        Instant now = Instant.now(clock);
        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("reason", reason);
        detail.put("old_priority", oldPriority.code());
        detail.put("new_priority", newPriority.code());
        detail.put("old_assignee_id", item.assigneeId());
        detail.put("new_assignee_id", newAssigneeId);
        activityRepository.append(item.id(), null, ACTION, detail, now);

        log.info("work_item_escalated workItemId={} reason={} priority={}->{} assignee={}->{}",
                item.id(), reason, oldPriority.code(), newPriority.code(), item.assigneeId(), newAssigneeId);

        return workItemRepository.findById(item.id())
                .orElseThrow(() -> new WorkItemNotFoundException(item.id()));
    }
}
