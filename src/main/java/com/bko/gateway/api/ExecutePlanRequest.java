package com.bko.gateway.api;

import com.bko.gateway.plan.QueryPlan;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record ExecutePlanRequest(
        @NotNull QueryPlan plan,
        String query,
        String operationName,
        Map<String, Object> variables
) {
}
