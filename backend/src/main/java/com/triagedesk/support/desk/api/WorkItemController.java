package com.triagedesk.support.desk.api;

import com.triagedesk.support.common.api.ApiResponse;
import com.triagedesk.support.desk.model.Channel;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.NewWorkItem;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.repo.WorkItemFilter;
import com.triagedesk.support.desk.service.WorkItemService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/work-items")
public class WorkItemController {

    private final WorkItemService workItemService;

    public WorkItemController(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @PostMapping
    public ApiResponse<WorkItemSummary> create(@Valid @RequestBody CreateWorkItemRequest req) {
        var created = workItemService.create(new NewWorkItem(
                Channel.fromCode(req.channel()),
                blankToNull(req.sender_email()),
                blankToNull(req.sender_name()),
                blankToNull(req.sender_id()),
                req.subject().trim(),
                req.content()
        ));
        return ApiResponse.ok(WorkItemSummary.from(created));
    }

    @GetMapping
    public ApiResponse<WorkItemPageResponse> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "priority", required = false) String priority,
            @RequestParam(value = "channel", required = false) String channel,
            @RequestParam(value = "assignee_id", required = false) String assigneeId,
            @RequestParam(value = "offset", required = false, defaultValue = "0") int offset,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit
    ) {
        var filter = new WorkItemFilter(
                status == null ? null : ItemStatus.fromCode(status),
                priority == null ? null : Priority.fromCode(priority),
                channel == null ? null : Channel.fromCode(channel),
                blankToNull(assigneeId)
        );
        var page = workItemService.list(filter, offset, limit);
        return ApiResponse.ok(new WorkItemPageResponse(
                page.items().stream().map(WorkItemSummary::from).toList(),
                page.total(),
                page.offset(),
                page.limit()
        ));
    }

    @GetMapping("/{id}")
    public ApiResponse<WorkItemSummary> get(@PathVariable("id") String workItemId) {
        return ApiResponse.ok(WorkItemSummary.from(workItemService.get(workItemId)));
    }

    @PostMapping("/{id}/status")
    public ApiResponse<WorkItemSummary> updateStatus(
            @PathVariable("id") String workItemId,
            @Valid @RequestBody UpdateStatusRequest req
    ) {
        var updated = workItemService.updateStatus(
                workItemId,
                ItemStatus.fromCode(req.status()),
                blankToNull(req.actor_id())
        );
        return ApiResponse.ok(WorkItemSummary.from(updated));
    }

    @GetMapping("/{id}/activities")
    public ApiResponse<List<ActivityItem>> activities(@PathVariable("id") String workItemId) {
        var items = workItemService.activities(workItemId).stream()
                .map(a -> new ActivityItem(
                        a.id(),
                        a.workItemId(),
                        a.actorId(),
                        a.action(),
                        a.detail(),
                        a.createdAt().getEpochSecond()
                ))
                .toList();
        return ApiResponse.ok(items);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
