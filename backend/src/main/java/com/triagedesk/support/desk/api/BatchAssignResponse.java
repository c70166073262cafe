package com.triagedesk.support.desk.api;

import java.util.List;

public record BatchAssignResponse(
        int assigned_count,
        List<WorkItemSummary> items
) {
}
