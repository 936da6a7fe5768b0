package com.e2eq.attribute.rest.models;

import com.e2eq.attribute.exceptions.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope of every attribute API response. Success carries {@code data} and optionally a
 * {@code message} and {@code pagination}; failure carries {@code error}, {@code code} and
 * optional {@code details}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private T data;
    private String message;
    private PaginationInfo pagination;
    private String error;
    private ErrorCode code;
    private List<String> details;

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder().success(true).data(data).build();
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return ApiResponse.<T>builder().success(true).data(data).message(message).build();
    }

    public static <T> ApiResponse<T> page(T data, PaginationInfo pagination) {
        return ApiResponse.<T>builder().success(true).data(data).pagination(pagination).build();
    }

    public static ApiResponse<Void> failure(ErrorCode code, String error, List<String> details) {
        return ApiResponse.<Void>builder()
                .success(false)
                .code(code)
                .error(error)
                .details(details == null || details.isEmpty() ? null : details)
                .build();
    }
}
