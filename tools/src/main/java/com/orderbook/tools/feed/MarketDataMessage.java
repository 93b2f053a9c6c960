package com.orderbook.tools.feed;

import com.orderbook.protocol.LevelView;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Messages an upstream market-data source delivers. Every message carries a
 * sequence number that must strictly increase across the stream.
 */
public sealed interface MarketDataMessage {

    long sequence();

    Instant timestamp();

    record NewOrder(long sequence, Instant timestamp, long orderId, Side side, OrderType type,
                    long price, long quantity) implements MarketDataMessage {
        public NewOrder {
            Objects.requireNonNull(side, "side");
            Objects.requireNonNull(type, "type");
        }
    }

    record CancelOrder(long sequence, Instant timestamp, long orderId) implements MarketDataMessage {}

    record ModifyOrder(long sequence, Instant timestamp, long orderId, long newPrice, long newQuantity)
            implements MarketDataMessage {}

    /** A trade that happened on the upstream venue. Informational only. */
    record TradePrint(long sequence, Instant timestamp, long price, long quantity, Side aggressorSide)
            implements MarketDataMessage {}

    /** Full depth of the upstream book, best level first on each side. */
    record DepthSnapshot(long sequence, Instant timestamp, List<LevelView> bids, List<LevelView> asks)
            implements MarketDataMessage {
        public DepthSnapshot {
            bids = List.copyOf(bids);
            asks = List.copyOf(asks);
        }
    }
}
