package com.bko.gateway.execution;

import com.bko.gateway.plan.ResponsePath;

import java.util.List;

/**
 * Where a plan node executes: the declared path from the root (wildcards kept) and the
 * concrete locations that path resolved to when the enclosing flatten ran.
 */
public record ExecutionScope(List<Object> declaredPath, List<ResolvedLocation> locations) {

    public static ExecutionScope root(ResponseTree tree) {
        return new ExecutionScope(List.of(), List.of(tree.root()));
    }

    public ExecutionScope flatten(List<String> path, ResponseTree tree) {
        return new ExecutionScope(ResponsePath.append(declaredPath, path), tree.resolve(locations, path));
    }

    /**
     * Path for errors that cannot be attributed to a single entity.
     */
    public List<Object> errorPrefix() {
        if (locations.size() == 1) {
            return locations.get(0).path();
        }
        return ResponsePath.concretePrefix(declaredPath);
    }
}
