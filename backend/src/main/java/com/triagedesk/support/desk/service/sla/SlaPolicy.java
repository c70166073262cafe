package com.triagedesk.support.desk.service.sla;

import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.WorkItem;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Side-effect free time checks. Every method takes {@code now} so callers decide the clock.
 */
@Component
public class SlaPolicy {

    static final double APPROACHING_SLA_RATIO = 0.8;
    static final double GETTING_STALE_RATIO = 0.5;

    private final EscalationThresholds thresholds;

    public SlaPolicy(EscalationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * No first response within the priority's SLA window.
     */
    public boolean breach(WorkItem item, Instant now) {
        if (item.firstResponseAt() != null) return false;
        return hoursSinceReceived(item, now) > thresholds.sla(item.priority());
    }

    /**
     * No status progress within the priority's stuck threshold.
     */
    public boolean stuck(WorkItem item, Instant now) {
        if (item.status() == ItemStatus.RESOLVED || item.status() == ItemStatus.CLOSED) return false;
        return hoursInStatus(item, now) > thresholds.stuck(item.priority());
    }

    /**
     * Strictly between 80% and 100% of the SLA window; past the window it is a breach instead.
     */
    public boolean approachingSla(WorkItem item, Instant now) {
        if (item.firstResponseAt() != null) return false;
        var sla = thresholds.sla(item.priority());
        var elapsed = hoursSinceReceived(item, now);
        return elapsed > sla * APPROACHING_SLA_RATIO && elapsed < sla;
    }

    public boolean gettingStale(WorkItem item, Instant now) {
        if (!item.status().isActive()) return false;
        return hoursInStatus(item, now) > thresholds.stuck(item.priority()) * GETTING_STALE_RATIO;
    }

    public double hoursSinceReceived(WorkItem item, Instant now) {
        return hours(item.receivedAt(), now);
    }

    public double hoursInStatus(WorkItem item, Instant now) {
        return hours(item.statusSince(), now);
    }

    public double slaHoursRemaining(WorkItem item, Instant now) {
        return thresholds.sla(item.priority()) - hoursSinceReceived(item, now);
    }

    private static double hours(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 3_600_000d;
    }
}
