package com.playarr.livetv.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every DynamoDB operation made by the live TV repositories.
 * Slow operations are logged at warn; all of them feed the dynamodb.query.duration timer.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);

    // Bulk deletes and inserts legitimately run for seconds, so only single reads are held to this
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run {@code queryOperation}, recording its duration under the given operation and table tags.
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS && !operation.startsWith("bulk")) {
                logger.warn("Slow DynamoDB operation: operation={}, table={}, duration={}ms",
                        operation, table, duration);
            } else {
                logger.debug("DynamoDB operation completed: operation={}, table={}, duration={}ms",
                        operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("DynamoDB operation failed: operation={}, table={}, duration={}ms, error={}",
                    operation, table, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                    .tag("operation", operation)
                    .tag("table", table)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}
