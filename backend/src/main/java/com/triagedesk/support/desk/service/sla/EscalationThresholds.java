package com.triagedesk.support.desk.service.sla;

import com.triagedesk.support.desk.model.Priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable per-priority time limits, in hours.
 *
 * @param slaHours   maximum time before a first response
 * @param stuckHours maximum time without status progress
 */
public record EscalationThresholds(Map<Priority, Double> slaHours, Map<Priority, Double> stuckHours) {

    public EscalationThresholds {
        slaHours = complete(slaHours, "sla_hours");
        stuckHours = complete(stuckHours, "stuck_hours");
    }

    private static Map<Priority, Double> complete(Map<Priority, Double> source, String name) {
        if (source == null || !source.keySet().containsAll(List.of(Priority.values()))) {
            throw new IllegalArgumentException(name + "_must_cover_all_priorities");
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public double sla(Priority priority) {
        return slaHours.get(priority);
    }

    public double stuck(Priority priority) {
        return stuckHours.get(priority);
    }

    public static Map<Priority, Double> defaultSlaHours() {
        var m = new EnumMap<Priority, Double>(Priority.class);
        m.put(Priority.URGENT, 0.5);
        m.put(Priority.HIGH, 2d);
        m.put(Priority.MEDIUM, 8d);
        m.put(Priority.LOW, 24d);
        return m;
    }

    public static Map<Priority, Double> defaultStuckHours() {
        var m = new EnumMap<Priority, Double>(Priority.class);
        m.put(Priority.URGENT, 2d);
        m.put(Priority.HIGH, 8d);
        m.put(Priority.MEDIUM, 24d);
        m.put(Priority.LOW, 72d);
        return m;
    }

    public static EscalationThresholds defaults() {
        return new EscalationThresholds(defaultSlaHours(), defaultStuckHours());
    }
}
