package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Agent;
import com.triagedesk.support.desk.model.AgentRole;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.Team;
import com.triagedesk.support.desk.repo.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Least-loaded pick within a team.
 *
 * <ol>
 *     <li>candidates: active AGENT-role members of the team</li>
 *     <li>drop anyone at or above the sum of all per-priority caps</li>
 *     <li>order by total load, then agent id (arbitrary but deterministic)</li>
 *     <li>prefer agents under the cap for the requested priority</li>
 *     <li>if nobody is, fall back to the ordered list from step 3</li>
 * </ol>
 */
@Component
public class AgentSelector {

    private static final Logger log = LoggerFactory.getLogger(AgentSelector.class);

    public record Candidate(Agent agent, AgentLoad load) {
    }

    private static final Comparator<Candidate> LEAST_LOADED = Comparator
            .comparingInt((Candidate c) -> c.load().total())
            .thenComparing(c -> c.agent().id());

    private final AgentRepository agentRepository;
    private final LoadCalculator loadCalculator;
    private final RoutingTables tables;

    public AgentSelector(AgentRepository agentRepository, LoadCalculator loadCalculator, RoutingTables tables) {
        this.agentRepository = agentRepository;
        this.loadCalculator = loadCalculator;
        this.tables = tables;
    }

    /**
     * @return the chosen agent, or empty when the team has no one with spare global capacity
     */
    public Optional<Agent> select(Team team, Priority priority) {
        var members = agentRepository.listActive(team, AgentRole.AGENT);
        var candidates = new ArrayList<Candidate>(members.size());
        for (var agent : members) {
            candidates.add(new Candidate(agent, loadCalculator.load(agent.id())));
        }

        var picked = choose(candidates, priority, tables);
        if (picked.isEmpty()) {
            log.info("no_agent_available team={} priority={} members={}", team.code(), priority.code(), members.size());
        } else {
            log.debug("agent_selected team={} priority={} agentId={}", team.code(), priority.code(), picked.get().id());
        }
        return picked;
    }

    static Optional<Agent> choose(List<Candidate> candidates, Priority priority, RoutingTables tables) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        var globalCap = tables.totalCapacity();
        var available = candidates.stream()
                .filter(c -> c.agent().active() && c.agent().role().isRoutable())
                .filter(c -> c.load().total() < globalCap)
                .sorted(LEAST_LOADED)
                .toList();
        if (available.isEmpty()) return Optional.empty();

        var priorityCap = tables.cap(priority);
        var suitable = available.stream()
                .filter(c -> c.load().count(priority) < priorityCap)
                .toList();
        if (suitable.isEmpty()) {
            log.debug("priority_cap_reached priority={} fallback=least_loaded", priority.code());
            suitable = available;
        }
        return Optional.of(suitable.get(0).agent());
    }
}
