package com.triagedesk.support.common.api;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DeskException.class)
    public ResponseEntity<ApiResponse<Void>> handleDesk(DeskException ex) {
        if (ex.status().is5xxServerError()) {
            log.warn("desk_error code={}", ex.code(), ex);
        } else {
            log.debug("desk_error code={} message={}", ex.code(), ex.getMessage());
        }
        return ResponseEntity.status(ex.status()).body(ApiResponse.error(ex.code()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleIllegalArgument(IllegalArgumentException ex) {
        return ApiResponse.error(ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleUnreadable(HttpMessageNotReadableException ex) {
        var root = NestedExceptionUtils.getMostSpecificCause(ex);
        if (root instanceof IllegalArgumentException iae && iae.getMessage() != null) {
            return ApiResponse.error(iae.getMessage());
        }
        return ApiResponse.error("malformed_request");
    }

    @ExceptionHandler({DuplicateKeyException.class, DataIntegrityViolationException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public ApiResponse<Void> handleConflict(Exception ex) {
        log.warn("data_conflict", ex);
        return ApiResponse.error("conflict");
    }

    @ExceptionHandler(BadSqlGrammarException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleBadSql(BadSqlGrammarException ex) {
        // Usually a schema/migration mismatch.
        var sql = ex.getSql();
        var root = NestedExceptionUtils.getMostSpecificCause(ex);
        if (root instanceof SQLException sqlEx) {
            log.warn(
                    "db_schema_mismatch sqlState={} errorCode={} sql={}",
                    sqlEx.getSQLState(),
                    sqlEx.getErrorCode(),
                    shortenSql(sql),
                    ex
            );
        } else {
            log.warn("db_schema_mismatch sql={}", shortenSql(sql), ex);
        }
        return ApiResponse.error("db_schema_mismatch");
    }

    private static String shortenSql(String sql) {
        if (sql == null) {
            return null;
        }
        var trimmed = sql.trim().replaceAll("\\s+", " ");
        var maxLen = 500;
        if (trimmed.length() <= maxLen) {
            return trimmed;
        }
        return trimmed.substring(0, maxLen) + "...";
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleDataAccess(DataAccessException ex) {
        log.warn("db_error", ex);
        return ApiResponse.error("db_error");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleValidation(MethodArgumentNotValidException ex) {
        var errors = ex.getBindingResult().getAllErrors();
        var msg = errors.isEmpty() ? "validation_error" : errors.get(0).getDefaultMessage();
        return ApiResponse.error(msg);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNotFound(Exception ex) {
        return ApiResponse.error("not_found");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleGeneric(Exception ex) {
        log.warn("unhandled_exception", ex);
        return ApiResponse.error("internal_error");
    }
}
