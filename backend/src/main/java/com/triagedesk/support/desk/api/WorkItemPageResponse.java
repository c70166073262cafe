package com.triagedesk.support.desk.api;

import java.util.List;

public record WorkItemPageResponse(
        List<WorkItemSummary> items,
        int total,
        int offset,
        int limit
) {
}
