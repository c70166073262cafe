package com.triagedesk.support.desk.repo;

import com.triagedesk.support.desk.model.Channel;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.Priority;

/**
 * Optional equality filters; null means "any".
 */
public record WorkItemFilter(ItemStatus status, Priority priority, Channel channel, String assigneeId) {

    public static WorkItemFilter any() {
        return new WorkItemFilter(null, null, null, null);
    }
}
