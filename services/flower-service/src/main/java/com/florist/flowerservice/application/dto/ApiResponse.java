package com.florist.flowerservice.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every successful response body: {@code {"success": true, "data": ..., "message":
 * ...}}. {@code message} is omitted when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> withMessage(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
