package com.triagedesk.support.desk.api;

import com.triagedesk.support.desk.model.WorkItem;

import java.time.Instant;
import java.util.List;

public record WorkItemSummary(
        String id,
        String channel,
        String sender_email,
        String sender_name,
        String sender_id,
        String subject,
        String content,
        String category,
        String priority,
        List<String> tags,
        String status,
        String assignee_id,
        long received_at,
        Long assigned_at,
        Long first_response_at,
        Long resolved_at,
        Double response_time_hours,
        Double resolution_time_hours
) {

    public static WorkItemSummary from(WorkItem item) {
        return new WorkItemSummary(
                item.id(),
                item.channel().code(),
                item.senderEmail(),
                item.senderName(),
                item.senderId(),
                item.subject(),
                item.content(),
                item.category().code(),
                item.priority().code(),
                item.tags().stream().sorted().toList(),
                item.status().code(),
                item.assigneeId(),
                item.receivedAt().getEpochSecond(),
                epochSeconds(item.assignedAt()),
                epochSeconds(item.firstResponseAt()),
                epochSeconds(item.resolvedAt()),
                item.responseTimeHours(),
                item.resolutionTimeHours()
        );
    }

    private static Long epochSeconds(Instant instant) {
        return instant == null ? null : instant.getEpochSecond();
    }
}
