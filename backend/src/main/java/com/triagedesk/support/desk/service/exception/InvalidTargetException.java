package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import org.springframework.http.HttpStatus;

/**
 * Explicit escalation target does not reference an existing agent.
 */
public class InvalidTargetException extends DeskException {

    public InvalidTargetException(String targetId) {
        super("invalid_target", "cannot escalate to unknown agent " + targetId);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
