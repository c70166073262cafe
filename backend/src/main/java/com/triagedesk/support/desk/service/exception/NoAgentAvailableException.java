package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import org.springframework.http.HttpStatus;

/**
 * Raised only at the HTTP edge; the assignment engine reports "nobody free" by leaving the item unassigned.
 */
public class NoAgentAvailableException extends DeskException {

    public NoAgentAvailableException(String workItemId) {
        super("no_agent_available", "no agent with capacity for work item " + workItemId);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
