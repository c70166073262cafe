package com.triagedesk.support.desk.api;

import java.util.List;

public record AtRiskResponse(
        List<ApproachingSlaItem> approaching_sla,
        List<GettingStaleItem> getting_stale
) {

    public record ApproachingSlaItem(String work_item_id, String subject, String priority, double hours_remaining) {
    }

    public record GettingStaleItem(String work_item_id, String subject, String status, String priority,
                                   double hours_in_status) {
    }
}
