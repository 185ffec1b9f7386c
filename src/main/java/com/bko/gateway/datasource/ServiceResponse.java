package com.bko.gateway.datasource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceResponse(Map<String, Object> data, List<ServiceError> errors) {

    public ServiceResponse {
        errors = errors == null ? List.of() : errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
