package com.bko.gateway.execution;

import com.bko.gateway.plan.ResponsePath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The response data of one plan execution. Concurrent branches only write through
 * {@link #merge(ResolvedLocation, Map)} and only read inside {@link #read(Supplier)}.
 */
public class ResponseTree {

    private final Map<String, Object> data = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ResultMerger merger;

    public ResponseTree(ResultMerger merger) {
        this.merger = merger;
    }

    public ResolvedLocation root() {
        return new ResolvedLocation(List.of(), data);
    }

    public void merge(ResolvedLocation location, Map<String, ?> incoming) {
        lock.writeLock().lock();
        try {
            merger.merge(location.target(), incoming);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Resolves {@code path} relative to each of {@code from}, in order. A wildcard segment
     * expands over the elements present in the addressed list; absent values, nulls and
     * scalars resolve to nothing.
     */
    public List<ResolvedLocation> resolve(List<ResolvedLocation> from, List<String> path) {
        return read(() -> {
            List<ResolvedLocation> resolved = new ArrayList<>();
            for (ResolvedLocation location : from) {
                collect(location.target(), location.path(), path, 0, resolved);
            }
            return resolved;
        });
    }

    /**
     * The assembled data. Only safe to call once every branch has completed.
     */
    public Map<String, Object> data() {
        return data;
    }

    private void collect(Object value, List<Object> currentPath, List<String> path, int index,
                         List<ResolvedLocation> out) {
        if (value == null) {
            return;
        }
        if (index == path.size()) {
            if (value instanceof Map<?, ?> map) {
                out.add(new ResolvedLocation(currentPath, ResultMerger.asObject(map)));
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    collect(list.get(i), ResponsePath.appendSegment(currentPath, i), path, index, out);
                }
            }
            return;
        }
        String segment = path.get(index);
        if (ResponsePath.isWildcard(segment)) {
            if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    Object element = list.get(i);
                    List<Object> elementPath = ResponsePath.appendSegment(currentPath, i);
                    if (element instanceof List<?>) {
                        // nested lists are flattened under the same wildcard
                        collect(element, elementPath, path, index, out);
                    } else {
                        collect(element, elementPath, path, index + 1, out);
                    }
                }
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            collect(map.get(segment), ResponsePath.appendSegment(currentPath, segment), path, index + 1, out);
        }
    }
}
