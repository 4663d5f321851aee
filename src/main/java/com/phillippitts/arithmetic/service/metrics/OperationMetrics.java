package com.phillippitts.arithmetic.service.metrics;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for operation requests.
 *
 * <p>Provides:
 * <ul>
 *   <li>Computation latency per operation</li>
 *   <li>Success count per operation</li>
 *   <li>Rejection count per operation and reason</li>
 * </ul>
 *
 * <p>Exposed through {@code /actuator/metrics} and {@code /actuator/prometheus}.
 */
@Component
public class OperationMetrics {

    private static final String METRIC_PREFIX = "arithmetic.operation";

    public static final String REASON_INVALID_REQUEST = "invalid_request";
    public static final String REASON_CONSTRAINT_VIOLATION = "constraint_violation";

    private final MeterRegistry registry;

    public OperationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a successful computation and its latency.
     *
     * @param operation operation that was computed
     * @param durationNanos time spent validating and computing
     */
    public void recordSuccess(ArithmeticOperation operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to validate and compute an operation")
                .tag("operation", tag(operation))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful computations")
                .tag("operation", tag(operation))
                .register(registry)
                .increment();
    }

    /**
     * Increments the rejection counter.
     *
     * @param operation operation the request was addressed to
     * @param reason {@link #REASON_INVALID_REQUEST} or {@link #REASON_CONSTRAINT_VIOLATION}
     */
    public void incrementRejected(ArithmeticOperation operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Number of rejected requests")
                .tag("operation", tag(operation))
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    private static String tag(ArithmeticOperation operation) {
        return operation.name().toLowerCase(Locale.ROOT);
    }
}
