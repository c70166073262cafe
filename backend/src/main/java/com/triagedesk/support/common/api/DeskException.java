package com.triagedesk.support.common.api;

import org.springframework.http.HttpStatus;

/**
 * Domain failure with a stable snake_case error code, rendered as {@link ApiResponse#error(String)}.
 */
public abstract class DeskException extends RuntimeException {

    private final String code;

    protected DeskException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public abstract HttpStatus status();
}
