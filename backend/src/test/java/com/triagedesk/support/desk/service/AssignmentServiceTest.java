package com.triagedesk.support.desk.service;

import com.triagedesk.support.bootstrap.TriageDeskApplication;
import com.triagedesk.support.desk.DeskFixtures;
import com.triagedesk.support.desk.model.Agent;
import com.triagedesk.support.desk.model.AgentRole;
import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ActivityRepository;
import com.triagedesk.support.desk.repo.AgentRepository;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.exception.AgentNotFoundException;
import com.triagedesk.support.desk.service.exception.WorkItemNotFoundException;
import com.triagedesk.support.desk.service.routing.LoadCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.triagedesk.support.desk.DeskFixtures.hoursAgo;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = TriageDeskApplication.class)
@ActiveProfiles({"dev", "test"})
class AssignmentServiceTest {

    @Autowired
    AssignmentService assignmentService;

    @Autowired
    BatchAssignmentService batchAssignmentService;

    @Autowired
    WorkItemService workItemService;

    @Autowired
    LoadCalculator loadCalculator;

    @Autowired
    WorkItemRepository workItemRepository;

    @Autowired
    ActivityRepository activityRepository;

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
    void auto_assign_routes_to_least_loaded_team_agent() {
        fixtures.item().assignedTo("sup_1", hoursAgo(1)).insert();
        var id = fixtures.item().insert();

        var result = assignmentService.assign(id, null, null);

        assertEquals("sup_2", result.assigneeId());
        assertEquals(ItemStatus.ASSIGNED, result.status());
        assertNotNull(result.assignedAt());

        var log = activityRepository.listByWorkItem(id, 10);
        assertEquals(1, log.size());
        assertEquals("assigned", log.get(0).action());
        assertFalse(log.get(0).detail().hasNonNull("old_assignee_id"));
        assertEquals("sup_2", log.get(0).detail().get("new_assignee_id").asText());
        assertEquals("auto", log.get(0).detail().get("method").asText());
    }

    @Test
    void tags_route_to_their_team() {
        var id = fixtures.item().tags("billing").insert();
        assertEquals("fin_1", assignmentService.assign(id, null, null).assigneeId());
    }

    @Test
    void newly_added_agent_joins_the_rotation() {
        agentRepository.insert(new Agent("eng_2", "Jo Engineer", "jo@triagedesk.local", Team.ENGINEERING,
                AgentRole.AGENT, true));
        fixtures.item().category(Category.BUG_REPORT).assignedTo("eng_1", hoursAgo(1)).insert();
        var id = fixtures.item().category(Category.BUG_REPORT).insert();

        assertEquals("eng_2", assignmentService.assign(id, null, null).assigneeId());
    }

    @Test
    void concurrent_auto_assign_ends_with_one_assignee() throws Exception {
        var id = fixtures.item().priority(Priority.HIGH).insert();
        int threads = 8;
        var pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<WorkItem>>();
            for (int i = 0; i < threads; i++) {
                Callable<WorkItem> call = () -> {
                    start.await(5, TimeUnit.SECONDS);
                    return assignmentService.assign(id, null, null);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            var seen = new HashSet<String>();
            for (var f : futures) {
                seen.add(f.get(30, TimeUnit.SECONDS).assigneeId());
            }
            assertEquals(1, seen.size());
            var stored = workItemRepository.findById(id).orElseThrow();
            assertEquals(seen.iterator().next(), stored.assigneeId());
            assertEquals(1, fixtures.activityCount(id, "assigned"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void already_assigned_item_is_left_alone_by_auto_assign() {
        var id = fixtures.item().assignedTo("sup_2", hoursAgo(2)).insert();
        var before = workItemRepository.findById(id).orElseThrow();

        var result = assignmentService.assign(id, null, null);

        assertEquals("sup_2", result.assigneeId());
        assertEquals(before.assignedAt(), result.assignedAt());
        assertEquals(0, activityRepository.countByWorkItem(id));
    }

    @Test
    void no_agent_leaves_item_untouched() {
        agentRepository.setActive("eng_1", false);
        var id = fixtures.item().tags("api").insert();

        var result = assignmentService.assign(id, null, null);

        assertNull(result.assigneeId());
        assertEquals(ItemStatus.NEW, result.status());
        assertEquals(0, activityRepository.countByWorkItem(id));
    }

    @Test
    void load_follows_assignment_and_resolution() {
        assertEquals(0, loadCalculator.load("sup_1").total());
        var id = fixtures.item().priority(Priority.URGENT).insert();

        assignmentService.assign(id, "sup_1", "admin_1");
        var load = loadCalculator.load("sup_1");
        assertEquals(1, load.total());
        assertEquals(1, load.count(Priority.URGENT));
        assertEquals(0, load.count(Priority.LOW));

        workItemService.updateStatus(id, ItemStatus.RESOLVED, "sup_1");
        assertEquals(0, loadCalculator.load("sup_1").total());
    }

    @Test
    void manual_assign_overrides_routing_and_capacity() {
        for (int i = 0; i < 3; i++) {
            fixtures.item().priority(Priority.URGENT).assignedTo("eng_1", hoursAgo(1)).insert();
        }
        var id = fixtures.item().priority(Priority.URGENT).assignedTo("sup_1", hoursAgo(1)).insert();

        var result = assignmentService.assign(id, "eng_1", "admin_1");

        assertEquals("eng_1", result.assigneeId());
        assertEquals(ItemStatus.ASSIGNED, result.status());
        var log = activityRepository.listByWorkItem(id, 10);
        assertEquals("manually_assigned", log.get(0).action());
        assertEquals("admin_1", log.get(0).actorId());
        assertEquals("sup_1", log.get(0).detail().get("old_assignee_id").asText());
        assertEquals("manual", log.get(0).detail().get("method").asText());
    }

    @Test
    void manual_assign_keeps_later_statuses() {
        var id = fixtures.item().assignedTo("sup_1", hoursAgo(1)).status(ItemStatus.IN_PROGRESS).insert();
        assertEquals(ItemStatus.IN_PROGRESS, assignmentService.assign(id, "sup_2", null).status());
    }

    @Test
    void unknown_ids_are_rejected() {
        var id = fixtures.item().insert();
        assertThrows(WorkItemNotFoundException.class, () -> assignmentService.assign("wi_missing", null, null));
        assertThrows(AgentNotFoundException.class, () -> assignmentService.assign(id, "ghost", null));
        assertNull(workItemRepository.findById(id).orElseThrow().assigneeId());
    }

    @Test
    void batch_processes_urgent_first_then_oldest() {
        var a = fixtures.item().id("wi_a").priority(Priority.LOW).receivedAt(hoursAgo(10)).insert();
        var b = fixtures.item().id("wi_b").priority(Priority.URGENT).receivedAt(hoursAgo(5)).insert();
        var c = fixtures.item().id("wi_c").priority(Priority.URGENT).receivedAt(hoursAgo(9)).insert();

        var assigned = batchAssignmentService.assignBatch(10);

        assertEquals(List.of(c, b, a), assigned.stream().map(WorkItem::id).toList());
        // later picks see earlier loads: support has two agents
        assertNotEquals(assigned.get(0).assigneeId(), assigned.get(1).assigneeId());
    }

    @Test
    void batch_limit_is_respected() {
        for (int i = 0; i < 3; i++) {
            fixtures.item().insert();
        }
        assertEquals(2, batchAssignmentService.assignBatch(2).size());
        assertEquals(1, workItemRepository.countUnassignedNew());
    }

    @Test
    void batch_skips_an_item_that_fails_and_keeps_going() {
        var gone = fixtures.item().id("wi_gone").priority(Priority.URGENT).receivedAt(hoursAgo(3)).insert();
        var kept = fixtures.item().id("wi_kept").priority(Priority.LOW).receivedAt(hoursAgo(2)).insert();

        var batch = new BatchAssignmentService(new WorkItemRepository(jdbcTemplate) {
            @Override
            public List<WorkItem> listUnassignedNew(int limit) {
                var items = super.listUnassignedNew(limit);
                jdbcTemplate.update("delete from work_item where id = ?", gone);
                return items;
            }
        }, assignmentService);

        var assigned = batch.assignBatch(10);

        assertEquals(List.of(kept), assigned.stream().map(WorkItem::id).toList());
        assertNotNull(workItemRepository.findById(kept).orElseThrow().assigneeId());
        assertTrue(workItemRepository.findById(gone).isEmpty());
    }
}
