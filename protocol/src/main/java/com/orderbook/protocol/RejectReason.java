package com.orderbook.protocol;

public enum RejectReason {
    INVALID_ORDER_ID,
    INVALID_QUANTITY,
    INVALID_PRICE,
    DUPLICATE_ORDER_ID,
    ORDER_NOT_FOUND,
    FILL_OR_KILL_UNSATISFIED,
    SYSTEM_BUSY
}
