package com.orderbook.protocol;

/**
 * Order type and time-in-force in one value.
 *
 * Only LIMIT, GTC and GFD may leave a remainder resting on the book.
 * GFD remainders are purged at the daily reset boundary.
 */
public enum OrderType {
    LIMIT,
    MARKET,  // no price bound, remainder discarded
    IOC,     // Immediate Or Cancel
    FOK,     // Fill Or Kill, all or nothing
    GTC,     // Good Till Cancel
    GFD;     // Good For Day

    public boolean requiresPrice() {
        return this != MARKET;
    }

    public boolean canRest() {
        return this == LIMIT || this == GTC || this == GFD;
    }
}
