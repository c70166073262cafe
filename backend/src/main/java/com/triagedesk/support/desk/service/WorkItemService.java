package com.triagedesk.support.desk.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.triagedesk.support.desk.model.ActivityRecord;
import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.NewWorkItem;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ActivityRepository;
import com.triagedesk.support.desk.repo.WorkItemFilter;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.classify.ClassificationDispatcher;
import com.triagedesk.support.desk.service.exception.InvalidStatusTransitionException;
import com.triagedesk.support.desk.service.exception.WorkItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class WorkItemService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    public static final Priority DEFAULT_PRIORITY = Priority.MEDIUM;
    public static final Category DEFAULT_CATEGORY = Category.GENERAL;

    private final WorkItemRepository workItemRepository;
    private final ActivityRepository activityRepository;
    private final ClassificationDispatcher classificationDispatcher;
    private final Clock clock;

    public WorkItemService(
            WorkItemRepository workItemRepository,
            ActivityRepository activityRepository,
            ClassificationDispatcher classificationDispatcher,
            Clock clock
    ) {
        this.workItemRepository = workItemRepository;
        this.activityRepository = activityRepository;
        this.classificationDispatcher = classificationDispatcher;
        this.clock = clock;
    }

    private void afterCommit(Runnable r) {
        if (r == null) return;
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    r.run();
                }
            });
        } else {
            r.run();
        }
    }

    /**
     * Store a newly received item as NEW with default priority and category. Classification is handed off
     * once the row is committed and never delays this call.
     */
    @Transactional
    public WorkItem create(NewWorkItem request) {
        if (request == null || request.channel() == null) throw new IllegalArgumentException("channel_required");
        if (request.subject() == null || request.subject().isBlank()) throw new IllegalArgumentException("subject_required");
        if (request.content() == null || request.content().isBlank()) throw new IllegalArgumentException("content_required");

        Instant now = Instant.now(clock);
        var id = workItemRepository.insert(request, DEFAULT_CATEGORY, DEFAULT_PRIORITY, now);

        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("channel", request.channel().code());
        detail.put("sender", request.senderEmail() != null ? request.senderEmail() : request.senderName());
        activityRepository.append(id, null, "created", detail, now);

        afterCommit(() -> classificationDispatcher.dispatch(id));
        log.info("work_item_created workItemId={} channel={}", id, request.channel().code());

        return workItemRepository.findById(id).orElseThrow(() -> new WorkItemNotFoundException(id));
    }

    public WorkItem get(String workItemId) {
        return workItemRepository.findById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
    }

    public WorkItemPage list(WorkItemFilter filter, int offset, int limit) {
        var safeOffset = Math.max(0, offset);
        var safeLimit = Math.max(1, Math.min(limit, 200));
        return new WorkItemPage(
                workItemRepository.list(filter, safeOffset, safeLimit),
                workItemRepository.count(filter),
                safeOffset,
                safeLimit
        );
    }

    public List<ActivityRecord> activities(String workItemId) {
        var item = get(workItemId);
        return activityRepository.listByWorkItem(item.id(), 1000);
    }

    /**
     * Move an item forward in its lifecycle. Entering IN_PROGRESS stamps the first response, entering RESOLVED
     * stamps the resolution; each timestamp is written once. Re-applying the current status is a no-op.
     */
    @Transactional
    public WorkItem updateStatus(String workItemId, ItemStatus target, String actorId) {
        if (target == null) throw new IllegalArgumentException("status_required");

        var item = workItemRepository.lockById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
        if (item.status() == target) {
            return item;
        }
        if (!item.status().canMoveTo(target)) {
            throw new InvalidStatusTransitionException(item.status(), target);
        }

        Instant now = Instant.now(clock);
        var firstResponseAt = item.firstResponseAt();
        var resolvedAt = item.resolvedAt();
        if (firstResponseAt == null && target.ordinal() >= ItemStatus.IN_PROGRESS.ordinal()) {
            firstResponseAt = now;
        }
        if (resolvedAt == null && target.ordinal() >= ItemStatus.RESOLVED.ordinal()) {
            resolvedAt = now;
        }
        workItemRepository.updateStatus(item.id(), target, firstResponseAt, resolvedAt);

        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("old_status", item.status().code());
        detail.put("new_status", target.code());
        activityRepository.append(item.id(), actorId, "status_changed", detail, now);

        log.info("work_item_status workItemId={} {}->{}", item.id(), item.status().code(), target.code());
        return workItemRepository.findById(item.id())
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
    }
}
