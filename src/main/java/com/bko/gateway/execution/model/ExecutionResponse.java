package com.bko.gateway.execution.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * The final {@code {data, errors}} envelope. {@code errors} is null, and omitted from JSON,
 * when nothing went wrong.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(Map<String, Object> data, List<GatewayError> errors) {

    public static ExecutionResponse of(Map<String, Object> data, List<GatewayError> errors) {
        return new ExecutionResponse(data, errors == null || errors.isEmpty() ? null : List.copyOf(errors));
    }

    public boolean hasErrors() {
        return errors != null;
    }
}
