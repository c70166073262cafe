package com.triagedesk.support.desk.api;

import java.util.List;

public record ScanResultResponse(
        List<String> urgent_unassigned,
        List<String> sla_breach,
        List<String> stuck,
        List<FailureItem> failures,
        int total_escalated,
        boolean skipped
) {

    public record FailureItem(String work_item_id, String trigger, String error) {
    }
}
