package com.triagedesk.support.desk.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.assignment.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class AssignmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AssignmentScheduler.class);

    private final BatchAssignmentService batchAssignmentService;
    private final int batchSize;

    public AssignmentScheduler(
            BatchAssignmentService batchAssignmentService,
            @Value("${app.assignment.queue-batch-size:50}") int batchSize
    ) {
        this.batchAssignmentService = batchAssignmentService;
        this.batchSize = Math.max(1, Math.min(batchSize, BatchAssignmentService.MAX_BATCH));
    }

    @Scheduled(fixedDelayString = "${app.assignment.queue-scan-interval-ms:60000}")
    public void drainQueue() {
        try {
            var assigned = batchAssignmentService.assignBatch(batchSize);
            if (!assigned.isEmpty()) {
                log.debug("queue_assign assigned={}", assigned.size());
            }
        } catch (Exception e) {
            log.warn("queue_assign_failed", e);
        }
    }
}
