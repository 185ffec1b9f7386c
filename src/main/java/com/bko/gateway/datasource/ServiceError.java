package com.bko.gateway.datasource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * A GraphQL error as reported by a backend service, with a service-local path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceError(String message, List<Object> path, Map<String, Object> extensions) {

    public ServiceError {
        path = path == null ? null : List.copyOf(path);
        extensions = extensions == null ? Map.of() : extensions;
    }
}
