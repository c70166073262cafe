package com.triagedesk.support.desk.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

public record WorkItem(
        String id,
        Channel channel,
        String senderEmail,
        String senderName,
        String senderId,
        String subject,
        String content,
        Category category,
        Priority priority,
        Set<String> tags,
        ItemStatus status,
        String assigneeId,
        Instant receivedAt,
        Instant assignedAt,
        Instant firstResponseAt,
        Instant resolvedAt
) {

    public WorkItem {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public WorkItem withTags(Set<String> newTags) {
        return new WorkItem(id, channel, senderEmail, senderName, senderId, subject, content, category, priority,
                newTags, status, assigneeId, receivedAt, assignedAt, firstResponseAt, resolvedAt);
    }

    public boolean isAssigned() {
        return assigneeId != null && !assigneeId.isBlank();
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * Reference point for staleness: last assignment, or arrival when never assigned.
     */
    public Instant statusSince() {
        return assignedAt != null ? assignedAt : receivedAt;
    }

    public Double responseTimeHours() {
        return hoursBetween(receivedAt, firstResponseAt);
    }

    public Double resolutionTimeHours() {
        return hoursBetween(receivedAt, resolvedAt);
    }

    private static Double hoursBetween(Instant from, Instant to) {
        if (from == null || to == null) return null;
        return Duration.between(from, to).toMillis() / 3_600_000d;
    }
}
