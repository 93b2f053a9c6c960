package com.orderbook.engine.book;

import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;

import java.time.Instant;

/**
 * An order slot in the {@link OrderPool} arena. Instances are obtained from the pool.
 * Fields are read/written directly, no getters/setters to keep hot paths clean.
 */
public final class Order {

    /** Null slot link. */
    public static final int NIL = -1;

    /** Arena position, fixed for the lifetime of the pool. */
    public final int slot;

    public long      orderId;
    public Side      side;
    public OrderType type;
    public long      price;     // fixed-point micros; 0 for MARKET
    public long      qty;       // remaining quantity
    public long      origQty;
    public String    owner;
    public Instant   createdAt;

    // Intrusive doubly-linked FIFO within a PriceLevel, by slot
    public int prev = NIL;
    public int next = NIL;

    boolean inUse;

    Order(int slot) {
        this.slot = slot;
    }

    public long filledQty() {
        return origQty - qty;
    }

    public boolean isInUse() {
        return inUse;
    }

    public void reset() {
        orderId = 0;
        side = null;
        type = null;
        price = 0;
        qty = 0;
        origQty = 0;
        owner = null;
        createdAt = null;
        prev = NIL;
        next = NIL;
    }

    @Override
    public String toString() {
        return "Order{id=" + orderId + ", " + side + " " + type + " " + qty + "/" + origQty + " @" + price
                + ", slot=" + slot + '}';
    }
}
