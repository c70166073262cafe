package com.triagedesk.support.desk.repo;

import com.triagedesk.support.desk.model.Agent;
import com.triagedesk.support.desk.model.AgentRole;
import com.triagedesk.support.desk.model.Team;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Agent directory. Inactive agents are only visible through {@link #findById(String)}.
 */
@Repository
public class AgentRepository {

    private static final RowMapper<Agent> MAPPER = (rs, rowNum) -> new Agent(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("email"),
            Team.fromCode(rs.getString("team")),
            AgentRole.fromCode(rs.getString("role")),
            rs.getBoolean("active")
    );

    private final JdbcTemplate jdbcTemplate;

    public AgentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Agent agent) {
        var sql = """
                insert into agent(id, name, email, team, role, active, created_at)
                values (?, ?, ?, ?, ?, ?, current_timestamp)
                """;
        jdbcTemplate.update(sql,
                agent.id(),
                agent.name(),
                agent.email(),
                agent.team().code(),
                agent.role().code(),
                agent.active()
        );
    }

    public Optional<Agent> findById(String agentId) {
        if (agentId == null || agentId.isBlank()) return Optional.empty();
        var sql = "select id, name, email, team, role, active from agent where id = ?";
        return jdbcTemplate.query(sql, MAPPER, agentId).stream().findFirst();
    }

    /**
     * Active agents, optionally narrowed by team and role, ordered by id.
     */
    public List<Agent> listActive(Team team, AgentRole role) {
        var sql = new StringBuilder("select id, name, email, team, role, active from agent where active = true");
        var args = new ArrayList<Object>();
        if (team != null) {
            sql.append(" and team = ?");
            args.add(team.code());
        }
        if (role != null) {
            sql.append(" and role = ?");
            args.add(role.code());
        }
        sql.append(" order by id asc");
        return jdbcTemplate.query(sql.toString(), MAPPER, args.toArray());
    }

    public Optional<Agent> findFirstActiveAdmin() {
        var sql = """
                select id, name, email, team, role, active
                from agent
                where role = ? and active = true
                order by id asc
                limit 1
                """;
        return jdbcTemplate.query(sql, MAPPER, AgentRole.ADMIN.code()).stream().findFirst();
    }

    public int setActive(String agentId, boolean active) {
        return jdbcTemplate.update("update agent set active = ? where id = ?", active, agentId);
    }
}
