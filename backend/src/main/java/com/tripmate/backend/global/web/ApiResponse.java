package com.tripmate.backend.global.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope; failures use {@link com.tripmate.backend.global.error.ProblemResponse}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    public static <T> ApiResponse<T> ok(String message) {
        return new ApiResponse<>(true, message, null);
    }
}
