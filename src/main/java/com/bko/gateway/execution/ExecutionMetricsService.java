package com.bko.gateway.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ExecutionMetricsService {

    private final AtomicLong planCount = new AtomicLong();
    private final AtomicLong fetchCount = new AtomicLong();
    private final AtomicLong skippedFetchCount = new AtomicLong();
    private final AtomicLong representationCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    public void recordPlanStarted() {
        planCount.incrementAndGet();
    }

    public void recordFetch(String serviceName, int representations) {
        long count = fetchCount.incrementAndGet();
        if (representations > 0) {
            representationCount.addAndGet(representations);
            log.debug("Fetch #{} sent (service={}, representations={}).", count, serviceName, representations);
        } else {
            log.debug("Fetch #{} sent (service={}).", count, serviceName);
        }
    }

    public void recordFetchSkipped(String serviceName) {
        long skipped = skippedFetchCount.incrementAndGet();
        log.debug("Entity fetch to service {} skipped: no qualifying representations. Total skipped={}.",
                serviceName, skipped);
    }

    public void recordErrors(int errors) {
        if (errors <= 0) {
            return;
        }
        errorCount.addAndGet(errors);
    }

    public long getFetchCount() {
        return fetchCount.get();
    }

    public long getSkippedFetchCount() {
        return skippedFetchCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public void logSummary() {
        log.info("Execution stats: totalPlans={}, totalFetches={}, skippedFetches={}, totalRepresentations={}, totalErrors={}.",
                planCount.get(), fetchCount.get(), skippedFetchCount.get(), representationCount.get(), errorCount.get());
    }
}
