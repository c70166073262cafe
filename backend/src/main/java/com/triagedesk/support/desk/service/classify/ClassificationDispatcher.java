package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.AssignmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget classification of freshly ingested items, followed by auto-assignment.
 *
 * Nothing here reaches back into the request that created the item: failures are logged and the item simply
 * keeps its ingestion defaults.
 */
@Component
public class ClassificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ClassificationDispatcher.class);

    private final WorkItemRepository workItemRepository;
    private final WorkItemClassifier classifier;
    private final ClassificationWriter writer;
    private final AssignmentService assignmentService;
    private final TaskExecutor executor;
    private final boolean autoAssign;

    public ClassificationDispatcher(
            WorkItemRepository workItemRepository,
            WorkItemClassifier classifier,
            ClassificationWriter writer,
            AssignmentService assignmentService,
            @Qualifier("classificationExecutor") TaskExecutor executor,
            @Value("${app.intake.auto-assign:true}") boolean autoAssign
    ) {
        this.workItemRepository = workItemRepository;
        this.classifier = classifier;
        this.writer = writer;
        this.assignmentService = assignmentService;
        this.executor = executor;
        this.autoAssign = autoAssign;
    }

    /**
     * Returns immediately; the future completes once classification (and assignment, when enabled) ran.
     */
    public CompletableFuture<Void> dispatch(String workItemId) {
        return CompletableFuture.runAsync(() -> process(workItemId), executor);
    }

    void process(String workItemId) {
        var item = workItemRepository.findById(workItemId).orElse(null);
        if (item == null) {
            log.warn("classification_item_missing workItemId={}", workItemId);
            return;
        }

        try {
            classifier.classify(item).ifPresent(c -> writer.apply(workItemId, c));
        } catch (Exception e) {
            log.warn("classification_failed workItemId={}", workItemId, e);
        }

        if (!autoAssign) return;
        try {
            assignmentService.assign(workItemId, null, null);
        } catch (Exception e) {
            log.warn("intake_auto_assign_failed workItemId={}", workItemId, e);
        }
    }
}
