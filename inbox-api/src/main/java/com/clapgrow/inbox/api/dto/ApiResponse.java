package com.clapgrow.inbox.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response wrapper shared by the inbox endpoints.
 *
 * @param <T> type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
