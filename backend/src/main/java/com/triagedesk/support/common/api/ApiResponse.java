package com.triagedesk.support.common.api;

/**
 * Envelope for every JSON answer. {@code error} carries a snake_case code and is null on success.
 */
public record ApiResponse<T>(boolean ok, T data, String error) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
