package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import org.springframework.http.HttpStatus;

public class AgentNotFoundException extends DeskException {

    public AgentNotFoundException(String agentId) {
        super("agent_not_found", "agent " + agentId + " not found");
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
