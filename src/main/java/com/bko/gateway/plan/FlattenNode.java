package com.bko.gateway.plan;

import java.util.List;

/**
 * Maps the output of {@code node} onto {@code path}, relative to the enclosing location.
 * A {@value ResponsePath#WILDCARD} segment expands over every element of the addressed list.
 */
public record FlattenNode(List<String> path, PlanNode node) implements PlanNode {

    public FlattenNode {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
