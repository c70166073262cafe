package com.triagedesk.support.desk.service;

import java.util.List;

/**
 * Outcome of one escalation scan. The same id may appear under several triggers.
 *
 * @param skipped true when another instance held the scan lock and nothing ran
 */
public record ScanResult(
        List<String> urgentUnassigned,
        List<String> slaBreach,
        List<String> stuck,
        List<Failure> failures,
        boolean skipped
) {

    public record Failure(String workItemId, EscalationTrigger trigger, String error) {
    }

    public ScanResult {
        urgentUnassigned = List.copyOf(urgentUnassigned);
        slaBreach = List.copyOf(slaBreach);
        stuck = List.copyOf(stuck);
        failures = List.copyOf(failures);
    }

    public int totalEscalated() {
        return urgentUnassigned.size() + slaBreach.size() + stuck.size();
    }

    public static ScanResult skippedRun() {
        return new ScanResult(List.of(), List.of(), List.of(), List.of(), true);
    }
}
