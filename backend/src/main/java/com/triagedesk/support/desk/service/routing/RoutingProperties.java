package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "app.routing")
public record RoutingProperties(
        Map<String, Integer> capacity,
        Map<String, String> categoryTeams,
        String defaultTeam
) {

    /**
     * Missing keys fall back to the built-in tables.
     */
    public RoutingTables toTables() {
        var caps = RoutingTables.defaultCapacity();
        if (capacity != null) {
            capacity.forEach((k, v) -> {
                if (v == null || v < 0) throw new IllegalArgumentException("invalid_capacity_" + k);
                caps.put(Priority.fromCode(k), v);
            });
        }

        Map<Category, Team> teams = new EnumMap<>(RoutingTables.defaultCategoryTeams());
        if (categoryTeams != null) {
            categoryTeams.forEach((k, v) -> teams.put(Category.fromCode(k), Team.fromCode(v)));
        }

        var fallback = defaultTeam == null || defaultTeam.isBlank() ? Team.SUPPORT : Team.fromCode(defaultTeam);
        return new RoutingTables(caps, RoutingTables.defaultTagRoutes(), teams, fallback);
    }
}
