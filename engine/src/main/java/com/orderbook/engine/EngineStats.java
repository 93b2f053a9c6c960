package com.orderbook.engine;

import com.orderbook.common.LatencyStats;
import com.orderbook.protocol.EngineStatistics;

import java.time.Instant;

/**
 * Running counters for one engine, guarded by this object's monitor rather than
 * the book lock, so statistics readers never wait on matching.
 */
final class EngineStats {

    private final LatencyStats latency = new LatencyStats("engine");

    private long ordersSubmitted;
    private long ordersRejected;
    private long cancellations;
    private long modifications;
    private long tradesExecuted;
    private long volumeTraded;
    private Instant since;

    EngineStats(Instant since) {
        this.since = since;
    }

    synchronized void onSubmit(long latencyNanos, int trades, long volume, boolean rejected) {
        ordersSubmitted++;
        if (rejected) ordersRejected++;
        tradesExecuted += trades;
        volumeTraded += volume;
        latency.record(latencyNanos);
    }

    synchronized void onCancel(long latencyNanos, boolean rejected) {
        if (rejected) ordersRejected++;
        else cancellations++;
        latency.record(latencyNanos);
    }

    synchronized void onModify(long latencyNanos, int trades, long volume, boolean rejected) {
        if (rejected) ordersRejected++;
        else modifications++;
        tradesExecuted += trades;
        volumeTraded += volume;
        latency.record(latencyNanos);
    }

    synchronized void reset(Instant now) {
        ordersSubmitted = 0;
        ordersRejected = 0;
        cancellations = 0;
        modifications = 0;
        tradesExecuted = 0;
        volumeTraded = 0;
        latency.reset();
        since = now;
    }

    synchronized EngineStatistics snapshot() {
        return new EngineStatistics(ordersSubmitted, ordersRejected, cancellations, modifications,
                tradesExecuted, volumeTraded,
                latency.count(), latency.totalNanos(), latency.minNanos(), latency.maxNanos(),
                latency.percentileNanos(99), since);
    }
}
