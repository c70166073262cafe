package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import org.springframework.http.HttpStatus;

public class WorkItemNotFoundException extends DeskException {

    public WorkItemNotFoundException(String workItemId) {
        super("work_item_not_found", "work item " + workItemId + " not found");
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
