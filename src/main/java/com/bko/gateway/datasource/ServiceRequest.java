package com.bko.gateway.datasource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A request sent to one backend service. {@code representations} is only set for entity
 * fetches; on the wire it travels as the {@code representations} variable.
 */
public record ServiceRequest(
        String query,
        String operationName,
        Map<String, Object> variables,
        List<Map<String, Object>> representations
) {

    public static final String REPRESENTATIONS_VARIABLE = "representations";

    public ServiceRequest {
        variables = variables == null ? Map.of() : variables;
    }

    public boolean isEntityRequest() {
        return representations != null;
    }

    /**
     * Variables as they are sent over the wire, with the representations folded in.
     */
    public Map<String, Object> wireVariables() {
        if (representations == null) {
            return variables;
        }
        Map<String, Object> merged = new LinkedHashMap<>(variables);
        merged.put(REPRESENTATIONS_VARIABLE, representations);
        return merged;
    }
}
