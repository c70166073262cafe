package com.triagedesk.support.desk.service;

import java.util.List;

public record AtRiskReport(List<ApproachingSla> approachingSla, List<GettingStale> gettingStale) {

    public record ApproachingSla(String workItemId, String subject, String priority, double hoursRemaining) {
    }

    public record GettingStale(String workItemId, String subject, String status, String priority, double hoursInStatus) {
    }

    public AtRiskReport {
        approachingSla = List.copyOf(approachingSla);
        gettingStale = List.copyOf(gettingStale);
    }
}
