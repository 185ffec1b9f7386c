package com.bko.gateway.execution.model;

import java.util.Map;

/**
 * Per-request inputs of one client operation.
 */
public record RequestContext(Map<String, Object> variables) {

    public RequestContext {
        variables = variables == null ? Map.of() : variables;
    }

    public static RequestContext empty() {
        return new RequestContext(Map.of());
    }
}
