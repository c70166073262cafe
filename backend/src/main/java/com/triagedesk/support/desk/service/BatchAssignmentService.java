package com.triagedesk.support.desk.service;

import com.triagedesk.support.common.api.DeskException;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains the unassigned queue, urgent and oldest first.
 *
 * Items are assigned one at a time, each in its own transaction, so every pick sees the load committed by the
 * picks before it.
 */
@Service
public class BatchAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(BatchAssignmentService.class);

    static final int MAX_BATCH = 500;

    private final WorkItemRepository workItemRepository;
    private final AssignmentService assignmentService;

    public BatchAssignmentService(WorkItemRepository workItemRepository, AssignmentService assignmentService) {
        this.workItemRepository = workItemRepository;
        this.assignmentService = assignmentService;
    }

    /**
     * @return the items that ended up with an assignee, in processing order
     */
    public List<WorkItem> assignBatch(int limit) {
        var queued = workItemRepository.listUnassignedNew(Math.max(1, Math.min(limit, MAX_BATCH)));
        var assigned = new ArrayList<WorkItem>(queued.size());
        for (var item : queued) {
            try {
                var result = assignmentService.assign(item.id(), null, null);
                if (result.isAssigned()) {
                    assigned.add(result);
                }
            } catch (DeskException e) {
                log.warn("batch_assign_item_failed workItemId={} error={}", item.id(), e.code());
            }
        }
        if (!queued.isEmpty()) {
            log.info("batch_assign assigned={} scanned={}", assigned.size(), queued.size());
        }
        return assigned;
    }
}
