package com.bko.gateway.execution;

import com.bko.gateway.execution.model.GatewayError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Append-only accumulator of the errors of one plan execution, shared by all branches.
 */
public class ErrorCollector {

    private final List<GatewayError> errors = new ArrayList<>();

    public synchronized void add(GatewayError error) {
        errors.add(error);
    }

    public synchronized void addAll(Collection<GatewayError> batch) {
        errors.addAll(batch);
    }

    public synchronized boolean isEmpty() {
        return errors.isEmpty();
    }

    public synchronized int size() {
        return errors.size();
    }

    public synchronized List<GatewayError> snapshot() {
        return List.copyOf(errors);
    }
}
