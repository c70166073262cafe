package com.triagedesk.support.desk.repo;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Channel;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.NewWorkItem;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;
import com.triagedesk.support.desk.model.WorkItem;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

@Repository
public class WorkItemRepository {

    public record AgentWorkloadRow(String agentId, String name, Team team, int activeTickets) {
    }

    // keeps each tag lookup well under the driver's bind parameter limit
    static final int TAG_LOOKUP_CHUNK = 1000;

    private static final String COLUMNS = """
            id, channel, sender_email, sender_name, sender_id, subject, content, category, priority, status,
            assignee_id, received_at, assigned_at, first_response_at, resolved_at
            """;

    private static final RowMapper<WorkItem> MAPPER = (rs, rowNum) -> new WorkItem(
            rs.getString("id"),
            Channel.fromCode(rs.getString("channel")),
            rs.getString("sender_email"),
            rs.getString("sender_name"),
            rs.getString("sender_id"),
            rs.getString("subject"),
            rs.getString("content"),
            Category.fromCode(rs.getString("category")),
            Priority.fromCode(rs.getString("priority")),
            Set.of(),
            ItemStatus.fromCode(rs.getString("status")),
            rs.getString("assignee_id"),
            instant(rs, "received_at"),
            instant(rs, "assigned_at"),
            instant(rs, "first_response_at"),
            instant(rs, "resolved_at")
    );

    private final JdbcTemplate jdbcTemplate;

    public WorkItemRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        var ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    public String insert(NewWorkItem item, Category category, Priority priority, Instant receivedAt) {
        var id = "wi_" + UUID.randomUUID();
        var sql = """
                insert into work_item(
                    id, channel, sender_email, sender_name, sender_id, subject, content,
                    category, priority, status, received_at
                ) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql,
                id,
                item.channel().code(),
                item.senderEmail(),
                item.senderName(),
                item.senderId(),
                item.subject(),
                item.content(),
                category.code(),
                priority.code(),
                ItemStatus.NEW.code(),
                ts(receivedAt)
        );
        return id;
    }

    public Optional<WorkItem> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        var sql = "select " + COLUMNS + " from work_item where id = ?";
        return withTags(jdbcTemplate.query(sql, MAPPER, id)).stream().findFirst();
    }

    /**
     * Reads the row under a write lock held until the surrounding transaction ends.
     */
    public Optional<WorkItem> lockById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        var sql = "select " + COLUMNS + " from work_item where id = ? for update";
        return withTags(jdbcTemplate.query(sql, MAPPER, id)).stream().findFirst();
    }

    public int updateAssignment(String id, String assigneeId, Instant assignedAt, ItemStatus status) {
        var sql = """
                update work_item
                set assignee_id = ?, assigned_at = ?, status = ?
                where id = ?
                """;
        return jdbcTemplate.update(sql, assigneeId, ts(assignedAt), status.code(), id);
    }

    public int updateEscalation(String id, Priority priority, String assigneeId) {
        var sql = "update work_item set priority = ?, assignee_id = ? where id = ?";
        return jdbcTemplate.update(sql, priority.code(), assigneeId, id);
    }

    public int updateStatus(String id, ItemStatus status, Instant firstResponseAt, Instant resolvedAt) {
        var sql = """
                update work_item
                set status = ?, first_response_at = ?, resolved_at = ?
                where id = ?
                """;
        return jdbcTemplate.update(sql, status.code(), ts(firstResponseAt), ts(resolvedAt), id);
    }

    public int updateCategory(String id, Category category) {
        return jdbcTemplate.update("update work_item set category = ? where id = ?", category.code(), id);
    }

    /**
     * Sets the priority only while it still equals {@code expected}.
     *
     * @return 1 when applied, 0 when the priority moved in the meantime
     */
    public int updatePriorityIfUnchanged(String id, Priority expected, Priority priority) {
        var sql = "update work_item set priority = ? where id = ? and priority = ?";
        return jdbcTemplate.update(sql, priority.code(), id, expected.code());
    }

    public void replaceTags(String id, Collection<String> tags) {
        jdbcTemplate.update("delete from work_item_tag where work_item_id = ?", id);
        if (tags == null || tags.isEmpty()) return;

        var rows = new ArrayList<Object[]>();
        for (var tag : new TreeSet<>(tags)) {
            rows.add(new Object[]{id, tag});
        }
        jdbcTemplate.batchUpdate("insert into work_item_tag(work_item_id, tag) values (?, ?)", rows);
    }

    /**
     * Unassigned NEW items, highest priority first, oldest first within a priority.
     */
    public List<WorkItem> listUnassignedNew(int limit) {
        var sql = "select " + COLUMNS + """
                from work_item
                where assignee_id is null
                  and status = 'new'
                order by %s desc, received_at asc, id asc
                limit ?
                """.formatted(Priority.rankSql("priority"));
        return withTags(jdbcTemplate.query(sql, MAPPER, limit));
    }

    public List<WorkItem> listUrgentUnassignedNew() {
        var sql = "select " + COLUMNS + """
                from work_item
                where priority = ?
                  and assignee_id is null
                  and status = 'new'
                order by received_at asc, id asc
                """;
        return withTags(jdbcTemplate.query(sql, MAPPER, Priority.URGENT.code()));
    }

    public List<WorkItem> listActive(boolean withoutFirstResponseOnly) {
        var sql = new StringBuilder("select ").append(COLUMNS).append(" from work_item where status in (")
                .append(placeholders(ItemStatus.activeCodes().size()))
                .append(")");
        if (withoutFirstResponseOnly) {
            sql.append(" and first_response_at is null");
        }
        sql.append(" order by received_at asc, id asc");
        return withTags(jdbcTemplate.query(sql.toString(), MAPPER, ItemStatus.activeCodes().toArray()));
    }

    public List<WorkItem> list(WorkItemFilter filter, int offset, int limit) {
        var args = new ArrayList<Object>();
        var sql = new StringBuilder("select ").append(COLUMNS).append(" from work_item");
        appendWhere(sql, args, filter);
        sql.append(" order by received_at desc, id desc limit ? offset ?");
        args.add(limit);
        args.add(offset);
        return withTags(jdbcTemplate.query(sql.toString(), MAPPER, args.toArray()));
    }

    public int count(WorkItemFilter filter) {
        var args = new ArrayList<Object>();
        var sql = new StringBuilder("select count(1) from work_item");
        appendWhere(sql, args, filter);
        Integer n = jdbcTemplate.queryForObject(sql.toString(), Integer.class, args.toArray());
        return n == null ? 0 : n;
    }

    private static void appendWhere(StringBuilder sql, List<Object> args, WorkItemFilter filter) {
        if (filter == null) return;
        var clauses = new ArrayList<String>();
        if (filter.status() != null) {
            clauses.add("status = ?");
            args.add(filter.status().code());
        }
        if (filter.priority() != null) {
            clauses.add("priority = ?");
            args.add(filter.priority().code());
        }
        if (filter.channel() != null) {
            clauses.add("channel = ?");
            args.add(filter.channel().code());
        }
        if (filter.assigneeId() != null && !filter.assigneeId().isBlank()) {
            clauses.add("assignee_id = ?");
            args.add(filter.assigneeId());
        }
        if (!clauses.isEmpty()) {
            sql.append(" where ").append(String.join(" and ", clauses));
        }
    }

    /**
     * Active item counts held by one agent, keyed by priority. Priorities without items map to 0.
     */
    public Map<Priority, Integer> countActiveByPriority(String agentId) {
        var sql = "select priority, count(1) as n from work_item where assignee_id = ? and status in ("
                + placeholders(ItemStatus.activeCodes().size()) + ") group by priority";
        var args = new ArrayList<Object>();
        args.add(agentId);
        args.addAll(ItemStatus.activeCodes());

        var counts = new EnumMap<Priority, Integer>(Priority.class);
        for (var p : Priority.values()) {
            counts.put(p, 0);
        }
        jdbcTemplate.query(sql, rs -> {
            counts.put(Priority.fromCode(rs.getString("priority")), rs.getInt("n"));
        }, args.toArray());
        return counts;
    }

    public int countUnassignedNew() {
        Integer n = jdbcTemplate.queryForObject(
                "select count(1) from work_item where assignee_id is null and status = 'new'",
                Integer.class
        );
        return n == null ? 0 : n;
    }

    /**
     * Items being worked (assigned or in progress), grouped by the assignee's team.
     */
    public Map<Team, Integer> countWorkingByTeam() {
        var sql = """
                select a.team, count(1) as n
                from work_item w
                join agent a on a.id = w.assignee_id
                where w.status in ('assigned', 'in_progress')
                group by a.team
                """;
        var counts = new EnumMap<Team, Integer>(Team.class);
        for (var t : Team.values()) {
            counts.put(t, 0);
        }
        jdbcTemplate.query(sql, rs -> {
            counts.put(Team.fromCode(rs.getString("team")), rs.getInt("n"));
        });
        return counts;
    }

    public List<AgentWorkloadRow> listAgentWorkloads() {
        var sql = """
                select a.id, a.name, a.team, count(w.id) as active_tickets
                from agent a
                join work_item w on w.assignee_id = a.id
                where w.status in ('assigned', 'in_progress')
                group by a.id, a.name, a.team
                order by active_tickets desc, a.id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new AgentWorkloadRow(
                rs.getString("id"),
                rs.getString("name"),
                Team.fromCode(rs.getString("team")),
                rs.getInt("active_tickets")
        ));
    }

    private List<WorkItem> withTags(List<WorkItem> items) {
        if (items.isEmpty()) return items;

        var ids = items.stream().map(WorkItem::id).toList();
        var tags = new HashMap<String, Set<String>>();
        for (int from = 0; from < ids.size(); from += TAG_LOOKUP_CHUNK) {
            var chunk = ids.subList(from, Math.min(ids.size(), from + TAG_LOOKUP_CHUNK));
            var sql = "select work_item_id, tag from work_item_tag where work_item_id in ("
                    + placeholders(chunk.size()) + ") order by tag asc";
            jdbcTemplate.query(sql, rs -> {
                tags.computeIfAbsent(rs.getString("work_item_id"), k -> new LinkedHashSet<>())
                        .add(rs.getString("tag"));
            }, chunk.toArray());
        }

        if (tags.isEmpty()) return items;
        var out = new ArrayList<WorkItem>(items.size());
        for (var item : items) {
            var t = tags.get(item.id());
            out.add(t == null ? item : item.withTags(t));
        }
        return out;
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }
}
