package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Agent;
import com.triagedesk.support.desk.model.AgentRole;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentSelectorTest {

    private final RoutingTables tables = RoutingTables.defaults();

    static AgentSelector.Candidate candidate(String id, Map<Priority, Integer> load) {
        var agent = new Agent(id, id, id + "@example.com", Team.SUPPORT, AgentRole.AGENT, true);
        return new AgentSelector.Candidate(agent, AgentLoad.of(id, load));
    }

    static Map<Priority, Integer> load(int low, int medium, int high, int urgent) {
        var m = new EnumMap<Priority, Integer>(Priority.class);
        m.put(Priority.LOW, low);
        m.put(Priority.MEDIUM, medium);
        m.put(Priority.HIGH, high);
        m.put(Priority.URGENT, urgent);
        return m;
    }

    @Test
    void empty_team_has_no_agent() {
        assertTrue(AgentSelector.choose(List.of(), Priority.HIGH, tables).isEmpty());
    }

    @Test
    void least_loaded_wins() {
        var picked = AgentSelector.choose(List.of(
                candidate("a", load(2, 1, 0, 0)),
                candidate("b", load(0, 1, 0, 0))
        ), Priority.MEDIUM, tables);
        assertEquals("b", picked.orElseThrow().id());
    }

    @Test
    void equal_load_breaks_tie_by_id() {
        var picked = AgentSelector.choose(List.of(
                candidate("zed", load(0, 1, 0, 0)),
                candidate("amy", load(1, 0, 0, 0))
        ), Priority.LOW, tables);
        assertEquals("amy", picked.orElseThrow().id());
    }

    @Test
    void agent_at_priority_cap_is_skipped_when_someone_else_fits() {
        var picked = AgentSelector.choose(List.of(
                candidate("a", load(0, 0, 0, 3)),
                candidate("b", load(4, 0, 0, 0))
        ), Priority.URGENT, tables);
        assertEquals("b", picked.orElseThrow().id());
    }

    @Test
    void sole_agent_at_priority_cap_is_still_returned() {
        var picked = AgentSelector.choose(List.of(candidate("solo", load(0, 0, 0, 3))), Priority.URGENT, tables);
        assertEquals("solo", picked.orElseThrow().id());
    }

    @Test
    void agent_at_global_capacity_is_never_picked() {
        // 15 + 10 + 5 + 3 = 33 active items
        var picked = AgentSelector.choose(List.of(candidate("full", load(15, 10, 5, 3))), Priority.LOW, tables);
        assertTrue(picked.isEmpty());

        var other = AgentSelector.choose(List.of(
                candidate("full", load(15, 10, 5, 3)),
                candidate("busy", load(15, 10, 5, 2))
        ), Priority.LOW, tables);
        assertEquals("busy", other.orElseThrow().id());
    }

    @Test
    void inactive_or_non_agent_roles_are_ignored() {
        var inactive = new AgentSelector.Candidate(
                new Agent("idle", "idle", "idle@example.com", Team.SUPPORT, AgentRole.AGENT, false),
                AgentLoad.of("idle", load(0, 0, 0, 0)));
        var admin = new AgentSelector.Candidate(
                new Agent("boss", "boss", "boss@example.com", Team.SUPPORT, AgentRole.ADMIN, true),
                AgentLoad.of("boss", load(0, 0, 0, 0)));
        assertTrue(AgentSelector.choose(List.of(inactive, admin), Priority.LOW, tables).isEmpty());
    }

    @Test
    void custom_caps_change_the_filter() {
        var caps = new EnumMap<Priority, Integer>(RoutingTables.defaultCapacity());
        caps.put(Priority.HIGH, 1);
        var strict = new RoutingTables(caps, RoutingTables.defaultTagRoutes(), RoutingTables.defaultCategoryTeams(),
                Team.SUPPORT);
        var picked = AgentSelector.choose(List.of(
                candidate("a", load(0, 0, 1, 0)),
                candidate("b", load(3, 0, 0, 0))
        ), Priority.HIGH, strict);
        assertEquals("b", picked.orElseThrow().id());
    }
}
