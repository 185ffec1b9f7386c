package com.bko.gateway.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryPlan(PlanNode node) {

    public static QueryPlan empty() {
        return new QueryPlan(null);
    }
}
