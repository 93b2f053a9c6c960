package com.orderbook.protocol;

import java.time.Instant;

/**
 * Immutable copy of the engine's running counters since {@code since}.
 * Latencies are nanoseconds per public operation.
 */
public record EngineStatistics(long ordersSubmitted,
                               long ordersRejected,
                               long cancellations,
                               long modifications,
                               long tradesExecuted,
                               long volumeTraded,
                               long operations,
                               long totalLatencyNanos,
                               long minLatencyNanos,
                               long maxLatencyNanos,
                               long p99LatencyNanos,
                               Instant since) {

    public double averageLatencyNanos() {
        return operations == 0 ? 0.0 : (double) totalLatencyNanos / operations;
    }

    public double averageLatencyMicros() {
        return averageLatencyNanos() / 1_000.0;
    }
}
