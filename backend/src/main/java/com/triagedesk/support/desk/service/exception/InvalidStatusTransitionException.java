package com.triagedesk.support.desk.service.exception;

import com.triagedesk.support.common.api.DeskException;
import com.triagedesk.support.desk.model.ItemStatus;
import org.springframework.http.HttpStatus;

public class InvalidStatusTransitionException extends DeskException {

    public InvalidStatusTransitionException(ItemStatus from, ItemStatus to) {
        super("invalid_status_transition", "cannot move from " + from.code() + " to " + to.code());
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
