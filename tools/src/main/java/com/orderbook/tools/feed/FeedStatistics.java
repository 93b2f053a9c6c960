package com.orderbook.tools.feed;

/** Counters kept by {@link MarketDataProcessor} since its last reset. */
public record FeedStatistics(long messagesProcessed,
                             long newOrders,
                             long cancellations,
                             long modifications,
                             long trades,
                             long snapshots,
                             long sequenceGaps,
                             long errors,
                             long lastSequence,
                             long minLatencyNanos,
                             long maxLatencyNanos,
                             double meanLatencyNanos) {
}
