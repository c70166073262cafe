package com.triagedesk.support.desk.api;

import com.triagedesk.support.bootstrap.TriageDeskApplication;
import com.triagedesk.support.desk.DeskFixtures;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.repo.AgentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static com.triagedesk.support.desk.DeskFixtures.hoursAgo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = TriageDeskApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles({"dev", "test"})
class AssignmentControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    AgentRepository agentRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    DeskFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new DeskFixtures(jdbcTemplate);
        fixtures.reset();
    }

    @Test
    void auto_assign_returns_assigned_item() throws Exception {
        var id = fixtures.item().tags("pricing").insert();

        mvc.perform(post("/api/v1/assignment/auto-assign/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.assignee_id").value("sales_1"))
                .andExpect(jsonPath("$.data.status").value("assigned"));
    }

    @Test
    void auto_assign_without_capacity_is_503() throws Exception {
        agentRepository.setActive("sales_1", false);
        var id = fixtures.item().tags("sales").insert();

        mvc.perform(post("/api/v1/assignment/auto-assign/{id}", id))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("no_agent_available"));
    }

    @Test
    void manual_assign_and_agent_load() throws Exception {
        var id = fixtures.item().priority(Priority.HIGH).insert();

        mvc.perform(post("/api/v1/assignment/manual-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"work_item_id":"%s","agent_id":"eng_1","actor_id":"admin_1"}
                                """.formatted(id)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assignee_id").value("eng_1"));

        mvc.perform(get("/api/v1/assignment/agent-load/{agentId}", "eng_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.agent_id").value("eng_1"))
                .andExpect(jsonPath("$.data.team").value("engineering"))
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.by_priority.high").value(1))
                .andExpect(jsonPath("$.data.by_priority.urgent").value(0));

        mvc.perform(get("/api/v1/assignment/agent-load/{agentId}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("agent_not_found"));
    }

    @Test
    void manual_assign_requires_agent_id() throws Exception {
        mvc.perform(post("/api/v1/assignment/manual-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"work_item_id":"wi_1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("agent_id_required"));
    }

    @Test
    void batch_assign_and_stats() throws Exception {
        fixtures.item().priority(Priority.URGENT).insert();
        fixtures.item().priority(Priority.LOW).insert();
        fixtures.item().tags("billing").insert();

        mvc.perform(post("/api/v1/assignment/batch-assign").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assigned_count").value(3))
                .andExpect(jsonPath("$.data.items[0].priority").value("urgent"));

        mvc.perform(get("/api/v1/assignment/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.unassigned").value(0))
                .andExpect(jsonPath("$.data.by_team.support").value(2))
                .andExpect(jsonPath("$.data.by_team.finance").value(1))
                .andExpect(jsonPath("$.data.by_team.sales").value(0))
                .andExpect(jsonPath("$.data.agent_workloads.length()").value(3));
    }

    @Test
    void escalate_endpoint_maps_errors() throws Exception {
        var id = fixtures.item().priority(Priority.LOW).insert();

        mvc.perform(post("/api/v1/assignment/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"work_item_id":"%s","reason":"vip","target_agent_id":"ghost"}
                                """.formatted(id)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_target"));

        agentRepository.setActive("admin_1", false);
        mvc.perform(post("/api/v1/assignment/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"work_item_id":"%s","reason":"vip"}
                                """.formatted(id)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("no_admin_available"));

        mvc.perform(post("/api/v1/assignment/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"work_item_id":"%s","reason":"vip","target_agent_id":"sup_2"}
                                """.formatted(id)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.priority").value("medium"))
                .andExpect(jsonPath("$.data.assignee_id").value("sup_2"));
    }

    @Test
    void check_escalations_and_at_risk() throws Exception {
        var breached = fixtures.item().priority(Priority.HIGH).assignedTo("sup_1", hoursAgo(1))
                .receivedAt(hoursAgo(3)).insert();
        var approaching = fixtures.item().priority(Priority.LOW).receivedAt(hoursAgo(21)).insert();
        fixtures.item().status(ItemStatus.CLOSED).receivedAt(hoursAgo(100)).insert();

        mvc.perform(post("/api/v1/assignment/check-escalations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sla_breach[0]").value(breached))
                .andExpect(jsonPath("$.data.total_escalated").value(1))
                .andExpect(jsonPath("$.data.skipped").value(false));

        mvc.perform(get("/api/v1/assignment/at-risk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.approaching_sla.length()").value(1))
                .andExpect(jsonPath("$.data.approaching_sla[0].work_item_id").value(approaching))
                .andExpect(jsonPath("$.data.approaching_sla[0].hours_remaining").isNumber());
    }
}
