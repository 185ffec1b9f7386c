package com.bko.gateway.execution.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A response-level error with its path in the client response and the standard extensions
 * {@code code}, {@code serviceName}, {@code query} and {@code variables}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(String message, List<Object> path, Map<String, Object> extensions) {

    public static final String CODE = "code";
    public static final String SERVICE_NAME = "serviceName";
    public static final String QUERY = "query";
    public static final String VARIABLES = "variables";

    public GatewayError {
        path = path == null ? null : Collections.unmodifiableList(path);
        extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public String code() {
        Object code = extensions.get(CODE);
        return code == null ? null : code.toString();
    }

    public String serviceName() {
        Object serviceName = extensions.get(SERVICE_NAME);
        return serviceName == null ? null : serviceName.toString();
    }
}
