package com.triagedesk.support.desk.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagedesk.support.desk.model.ActivityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log. There is deliberately no update or delete.
 */
@Repository
public class ActivityRepository {

    private static final Logger log = LoggerFactory.getLogger(ActivityRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ActivityRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void append(String workItemId, String actorId, String action, JsonNode detail, Instant createdAt) {
        String detailJson;
        try {
            detailJson = objectMapper.writeValueAsString(detail == null ? objectMapper.createObjectNode() : detail);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("activity_detail_not_serializable", e);
        }

        var sql = """
                insert into work_item_activity(work_item_id, actor_id, action, detail_json, created_at)
                values (?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql, workItemId, actorId, action, detailJson, Timestamp.from(createdAt));
    }

    public List<ActivityRecord> listByWorkItem(String workItemId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1000));
        var sql = """
                select id, work_item_id, actor_id, action, detail_json, created_at
                from work_item_activity
                where work_item_id = ?
                order by id asc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            JsonNode detail;
            try {
                detail = objectMapper.readTree(rs.getString("detail_json"));
            } catch (JsonProcessingException e) {
                log.warn("activity_detail_unreadable id={}", rs.getLong("id"));
                detail = objectMapper.createObjectNode();
            }
            return new ActivityRecord(
                    rs.getLong("id"),
                    rs.getString("work_item_id"),
                    rs.getString("actor_id"),
                    rs.getString("action"),
                    detail,
                    rs.getTimestamp("created_at").toInstant()
            );
        }, workItemId, safeLimit);
    }

    public int countByWorkItem(String workItemId) {
        Integer n = jdbcTemplate.queryForObject(
                "select count(1) from work_item_activity where work_item_id = ?",
                Integer.class,
                workItemId
        );
        return n == null ? 0 : n;
    }
}
