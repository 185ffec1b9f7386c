package com.bko.gateway.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Calls one backend service. A fetch with {@code requires} is an entity fetch: it sends the
 * representations of already-known entities and merges the resolved entities back in place.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchNode(
        String serviceName,
        String operation,
        String operationName,
        List<String> variableUsages,
        List<Selection> requires,
        String typeCondition
) implements PlanNode {

    public FetchNode {
        variableUsages = variableUsages == null ? List.of() : List.copyOf(variableUsages);
        requires = requires == null ? null : List.copyOf(requires);
    }

    @JsonIgnore
    public boolean isEntityFetch() {
        return requires != null && !requires.isEmpty();
    }
}
