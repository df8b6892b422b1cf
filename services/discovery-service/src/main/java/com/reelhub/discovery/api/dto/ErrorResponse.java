package com.reelhub.discovery.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body: {@code {error:{code,message}, trace_id, request_id}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    Error error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this(new Error(code, message), traceId, requestId);
    }

    public record Error(String code, String message) {
    }
}
