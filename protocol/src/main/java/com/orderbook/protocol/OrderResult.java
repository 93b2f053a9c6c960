package com.orderbook.protocol;

import java.util.List;

/**
 * Outcome of a submit, cancel or modify.
 *
 * @param rejectReason null unless {@code status == REJECTED}
 * @param trades       executions in generation order, earliest first
 */
public record OrderResult(long orderId,
                          OrderStatus status,
                          RejectReason rejectReason,
                          List<Trade> trades,
                          long filledQuantity,
                          long remainingQuantity) {

    public OrderResult {
        trades = List.copyOf(trades);
    }

    public static OrderResult rejected(long orderId, RejectReason reason) {
        return new OrderResult(orderId, OrderStatus.REJECTED, reason, List.of(), 0, 0);
    }

    public static OrderResult cancelled(long orderId, long remainingQuantity) {
        return new OrderResult(orderId, OrderStatus.CANCELLED, null, List.of(), 0, remainingQuantity);
    }

    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }
}
