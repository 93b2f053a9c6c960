package com.orderbook.protocol;

import java.util.Objects;

/**
 * A new order as submitted by a caller.
 *
 * @param orderId  caller-chosen positive id, unique among resting orders
 * @param price    fixed-point limit price (micros); ignored for {@link OrderType#MARKET}
 * @param quantity requested quantity, must be positive
 * @param owner    opaque owner tag, may be null
 */
public record OrderRequest(long orderId, Side side, OrderType type, long price, long quantity, String owner) {

    public OrderRequest {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(type, "type");
    }

    public static OrderRequest limit(long orderId, Side side, long price, long quantity) {
        return new OrderRequest(orderId, side, OrderType.LIMIT, price, quantity, null);
    }

    public static OrderRequest market(long orderId, Side side, long quantity) {
        return new OrderRequest(orderId, side, OrderType.MARKET, 0, quantity, null);
    }

    public static OrderRequest of(long orderId, Side side, OrderType type, long price, long quantity) {
        return new OrderRequest(orderId, side, type, price, quantity, null);
    }

    public OrderRequest withOwner(String owner) {
        return new OrderRequest(orderId, side, type, price, quantity, owner);
    }
}
