package com.orderbook.protocol;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * Point-in-time view of the best levels on each side, best first.
 *
 * @param sequence the engine's mutation counter at capture time
 */
public record BookSnapshot(List<LevelView> bids, List<LevelView> asks, long sequence, Instant timestamp) {

    public BookSnapshot {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public OptionalLong bestBid() {
        return bids.isEmpty() ? OptionalLong.empty() : OptionalLong.of(bids.get(0).price());
    }

    public OptionalLong bestAsk() {
        return asks.isEmpty() ? OptionalLong.empty() : OptionalLong.of(asks.get(0).price());
    }

    public OptionalLong spread() {
        if (bids.isEmpty() || asks.isEmpty()) return OptionalLong.empty();
        return OptionalLong.of(asks.get(0).price() - bids.get(0).price());
    }
}
