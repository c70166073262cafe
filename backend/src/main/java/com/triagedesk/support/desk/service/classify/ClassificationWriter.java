package com.triagedesk.support.desk.service.classify;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ActivityRepository;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.WorkItemService;
import com.triagedesk.support.desk.service.exception.WorkItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.TreeSet;

/**
 * Stores a classifier verdict. The classified priority only replaces the ingestion default: once an escalation
 * has moved the item, its priority is left alone.
 */
@Service
public class ClassificationWriter {

    private static final Logger log = LoggerFactory.getLogger(ClassificationWriter.class);

    public static final String ACTION = "categorized";

    private final WorkItemRepository workItemRepository;
    private final ActivityRepository activityRepository;
    private final Clock clock;

    public ClassificationWriter(
            WorkItemRepository workItemRepository,
            ActivityRepository activityRepository,
            Clock clock
    ) {
        this.workItemRepository = workItemRepository;
        this.activityRepository = activityRepository;
        this.clock = clock;
    }

    @Transactional
    public WorkItem apply(String workItemId, Classification classification) {
        var item = workItemRepository.lockById(workItemId)
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));

        var category = classification.category() != null ? classification.category() : item.category();
        boolean categoryChanged = category != item.category();

        var tags = new TreeSet<>(item.tags());
        tags.addAll(classification.tags());
        boolean tagsChanged = !tags.equals(new TreeSet<>(item.tags()));

        var priority = item.priority();
        boolean priorityApplied = false;
        if (classification.priority() != null && classification.priority() != item.priority()) {
            priorityApplied = workItemRepository.updatePriorityIfUnchanged(
                    item.id(), WorkItemService.DEFAULT_PRIORITY, classification.priority()) == 1;
            if (priorityApplied) {
                priority = classification.priority();
            }
        }

        if (!categoryChanged && !tagsChanged && !priorityApplied) {
            log.debug("classification_unchanged workItemId={}", item.id());
            return item;
        }
        if (categoryChanged) {
            workItemRepository.updateCategory(item.id(), category);
        }
        if (tagsChanged) {
            workItemRepository.replaceTags(item.id(), tags);
        }

        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("category", category.code());
        detail.put("priority", priority.code());
        detail.put("priority_applied", priorityApplied);
        var tagArray = detail.putArray("tags");
        tags.forEach(tagArray::add);
        if (classification.reasoning() != null) {
            detail.put("reasoning", classification.reasoning());
        }
        activityRepository.append(item.id(), null, ACTION, detail, Instant.now(clock));

        return workItemRepository.findById(item.id())
                .orElseThrow(() -> new WorkItemNotFoundException(workItemId));
    }
}
