package com.orderbook.protocol;

/** One price level as seen by a snapshot consumer. */
public record LevelView(long price, long quantity, int orderCount) {
}
