package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable routing configuration: per-priority capacity caps, tag overrides and the category to team table.
 *
 * @param capacity     maximum concurrent active items of each priority one agent may hold
 * @param tagRoutes    checked in order; the first route with a matching tag wins
 * @param categoryTeam fallback table when no tag route matches
 * @param defaultTeam  used for categories missing from {@code categoryTeam}
 */
public record RoutingTables(
        Map<Priority, Integer> capacity,
        List<TagRoute> tagRoutes,
        Map<Category, Team> categoryTeam,
        Team defaultTeam
) {

    public record TagRoute(Set<String> tags, Team team) {
        public TagRoute {
            tags = Set.copyOf(tags);
        }
    }

    public RoutingTables {
        if (capacity == null || !capacity.keySet().containsAll(List.of(Priority.values()))) {
            throw new IllegalArgumentException("capacity_must_cover_all_priorities");
        }
        capacity = Collections.unmodifiableMap(new EnumMap<>(capacity));
        tagRoutes = tagRoutes == null ? List.of() : List.copyOf(tagRoutes);
        categoryTeam = categoryTeam == null || categoryTeam.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(categoryTeam));
        defaultTeam = defaultTeam == null ? Team.SUPPORT : defaultTeam;
    }

    public int cap(Priority priority) {
        return capacity.get(priority);
    }

    /**
     * Global overload guard: an agent holding this many active items gets nothing new.
     */
    public int totalCapacity() {
        return capacity.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Team teamFor(Category category) {
        if (category == null) return defaultTeam;
        return categoryTeam.getOrDefault(category, defaultTeam);
    }

    public static List<TagRoute> defaultTagRoutes() {
        return List.of(
                new TagRoute(Set.of("billing", "payment"), Team.FINANCE),
                new TagRoute(Set.of("api", "technical"), Team.ENGINEERING),
                new TagRoute(Set.of("sales", "pricing"), Team.SALES)
        );
    }

    public static Map<Category, Team> defaultCategoryTeams() {
        var m = new EnumMap<Category, Team>(Category.class);
        m.put(Category.QUESTION, Team.SUPPORT);
        m.put(Category.COMPLAINT, Team.SUPPORT);
        m.put(Category.FEEDBACK, Team.SUPPORT);
        m.put(Category.GENERAL, Team.SUPPORT);
        m.put(Category.REQUEST, Team.SALES);
        m.put(Category.BUG_REPORT, Team.ENGINEERING);
        return m;
    }

    public static Map<Priority, Integer> defaultCapacity() {
        var m = new EnumMap<Priority, Integer>(Priority.class);
        m.put(Priority.URGENT, 3);
        m.put(Priority.HIGH, 5);
        m.put(Priority.MEDIUM, 10);
        m.put(Priority.LOW, 15);
        return m;
    }

    public static RoutingTables defaults() {
        return new RoutingTables(defaultCapacity(), defaultTagRoutes(), defaultCategoryTeams(), Team.SUPPORT);
    }
}
