package com.triagedesk.support.desk.service.sla;

import com.triagedesk.support.desk.model.Priority;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

@ConfigurationProperties(prefix = "app.escalation")
public record EscalationProperties(
        Map<String, Double> slaHours,
        Map<String, Double> stuckHours
) {

    public EscalationThresholds toThresholds() {
        var sla = EscalationThresholds.defaultSlaHours();
        var stuck = EscalationThresholds.defaultStuckHours();
        if (slaHours != null) {
            slaHours.forEach((k, v) -> sla.put(Priority.fromCode(k), positive(k, v)));
        }
        if (stuckHours != null) {
            stuckHours.forEach((k, v) -> stuck.put(Priority.fromCode(k), positive(k, v)));
        }
        return new EscalationThresholds(sla, stuck);
    }

    private static double positive(String key, Double hours) {
        if (hours == null || hours <= 0) {
            throw new IllegalArgumentException("invalid_threshold_" + key);
        }
        return hours;
    }
}
