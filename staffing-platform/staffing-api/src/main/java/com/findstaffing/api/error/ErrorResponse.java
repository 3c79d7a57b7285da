package com.findstaffing.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Wire shape of every failure: {@code {"error": {"code", "message", "details"?}}}.
 */
public record ErrorResponse(ErrorBody error) {

    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(new ErrorBody(kind.code(), message, null));
    }

    public static ErrorResponse of(AdminOperationException e) {
        Map<String, Object> details = e.getDetails().isEmpty() ? null : e.getDetails();
        return new ErrorResponse(new ErrorBody(e.getKind().code(), e.getMessage(), details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String code, String message, Map<String, Object> details) {}
}
