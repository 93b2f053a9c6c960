package com.orderbook.protocol;

public enum OrderStatus {
    RESTING,            // on the book, nothing filled
    PARTIALLY_FILLED,   // traded, remainder on the book
    FILLED,
    CANCELLED,          // removed without a full fill: cancel, day reset, or discarded IOC/market remainder
    REJECTED
}
