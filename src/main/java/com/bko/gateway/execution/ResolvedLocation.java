package com.bko.gateway.execution;

import java.util.List;
import java.util.Map;

/**
 * A concrete object in the response tree together with its response path.
 */
public record ResolvedLocation(List<Object> path, Map<String, Object> target) {
}
