package com.triagedesk.support.desk.service.routing;

import com.triagedesk.support.desk.model.Team;
import com.triagedesk.support.desk.model.WorkItem;
import org.springframework.stereotype.Component;

/**
 * Maps a work item to the team that should own it. Tag routes win over the category table.
 */
@Component
public class TeamResolver {

    private final RoutingTables tables;

    public TeamResolver(RoutingTables tables) {
        this.tables = tables;
    }

    public Team resolve(WorkItem item) {
        if (item == null) throw new IllegalArgumentException("work_item_required");

        if (!item.tags().isEmpty()) {
            for (var route : tables.tagRoutes()) {
                for (var tag : route.tags()) {
                    if (item.hasTag(tag)) {
                        return route.team();
                    }
                }
            }
        }
        return tables.teamFor(item.category());
    }
}
