package com.orderbook.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latency accumulator backed by HdrHistogram.
 * Record nanos; read percentiles and running totals. All methods synchronize on
 * this instance, so recording never needs the caller's own locks.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    // max 10 seconds, 3 sig figs
    private static final long HIGHEST_TRACKABLE_NANOS = 10_000_000_000L;

    private final String name;
    private final Histogram histogram = new Histogram(HIGHEST_TRACKABLE_NANOS, 3);
    private long count;
    private long totalNanos;
    private long minNanos = Long.MAX_VALUE;
    private long maxNanos;

    public LatencyStats(String name) {
        this.name = name;
    }

    public synchronized void record(long latencyNanos) {
        long v = Math.max(0, latencyNanos);
        histogram.recordValue(Math.min(v, HIGHEST_TRACKABLE_NANOS));
        count++;
        totalNanos += v;
        if (v < minNanos) minNanos = v;
        if (v > maxNanos) maxNanos = v;
    }

    public synchronized long count()       { return count; }
    public synchronized long totalNanos()  { return totalNanos; }
    public synchronized long minNanos()    { return count == 0 ? 0 : minNanos; }
    public synchronized long maxNanos()    { return maxNanos; }

    public synchronized double meanNanos() {
        return count == 0 ? 0.0 : (double) totalNanos / count;
    }

    public synchronized long percentileNanos(double percentile) {
        return count == 0 ? 0 : histogram.getValueAtPercentile(percentile);
    }

    public synchronized void reset() {
        histogram.reset();
        count = 0;
        totalNanos = 0;
        minNanos = Long.MAX_VALUE;
        maxNanos = 0;
    }

    public synchronized void logAndReset() {
        if (count == 0) return;
        log.info("{} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                name, count,
                micros(histogram.getValueAtPercentile(50)),
                micros(histogram.getValueAtPercentile(99)),
                micros(histogram.getValueAtPercentile(99.9)),
                micros(histogram.getMaxValue()));
        reset();
    }

    public String name() { return name; }

    private static String micros(long nanos) {
        return String.format("%.1f", nanos / 1_000.0);
    }
}
