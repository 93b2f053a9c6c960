package com.orderbook.protocol;

import java.time.Instant;

/**
 * An execution between a resting (maker) and an incoming (taker) order.
 * Always priced at the maker's price.
 */
public record Trade(long tradeId,
                    long buyOrderId,
                    long sellOrderId,
                    Side aggressorSide,
                    long price,
                    long quantity,
                    Instant timestamp) {

    public long makerOrderId() {
        return aggressorSide == Side.BUY ? sellOrderId : buyOrderId;
    }

    public long takerOrderId() {
        return aggressorSide == Side.BUY ? buyOrderId : sellOrderId;
    }
}
