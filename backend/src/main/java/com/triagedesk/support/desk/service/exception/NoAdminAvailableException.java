package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import org.springframework.http.HttpStatus;

public class NoAdminAvailableException extends DeskException {

    public NoAdminAvailableException(String workItemId) {
        super("no_admin_available", "no active admin to take escalated work item " + workItemId);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}
