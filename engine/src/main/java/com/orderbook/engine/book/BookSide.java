package com.orderbook.engine.book;

import com.orderbook.protocol.Side;

import java.util.Collection;
import java.util.Collections;
import java.util.TreeMap;

/**
 * Price levels for one side of the book, best price first:
 *   - BUY:  descending (best bid = highest price = first entry)
 *   - SELL: ascending  (best ask = lowest price = first entry)
 *
 * An empty level never stays in the map; it is returned to the pool as soon as
 * its last order leaves.
 */
public final class BookSide {

    private final Side side;
    private final PriceLevelPool levelPool;
    private final TreeMap<Long, PriceLevel> levels; // price -> level

    public BookSide(Side side, PriceLevelPool levelPool) {
        this.side = side;
        this.levelPool = levelPool;
        this.levels = side == Side.BUY ? new TreeMap<>(Collections.reverseOrder()) : new TreeMap<>();
    }

    /** Append to the FIFO tail of the order's price level, creating the level if absent. */
    public void insert(Order o) {
        if (o.side != side) throw new InvariantViolationException(o + " inserted on " + side + " side");
        PriceLevel level = levels.get(o.price);
        if (level == null) {
            level = levelPool.borrow(o.price);
            levels.put(o.price, level);
        }
        level.addOrder(o);
    }

    /** Unlink from its level; drops the level if it becomes empty. */
    public void remove(Order o) {
        PriceLevel level = levelOf(o);
        level.removeOrder(o);
        dropIfEmpty(level);
    }

    /**
     * Decrement an order's remaining quantity in place. Returns true when it reached
     * zero and was removed from the level.
     */
    public boolean reduce(Order o, long amount) {
        return reduce(levelOf(o), o, amount);
    }

    boolean reduce(PriceLevel level, Order o, long amount) {
        if (amount <= 0 || amount > o.qty) {
            throw new InvariantViolationException("Cannot reduce " + o + " by " + amount);
        }
        o.qty -= amount;
        level.totalQty -= amount;
        if (o.qty > 0) return false;
        level.removeOrder(o);
        dropIfEmpty(level);
        return true;
    }

    /** Best level, or null when the side is empty. */
    public PriceLevel peekBest() {
        return levels.isEmpty() ? null : levels.firstEntry().getValue();
    }

    public PriceLevel level(long price) {
        return levels.get(price);
    }

    /** Levels in priority order, best first. Read-only view. */
    public Collection<PriceLevel> levels() {
        return Collections.unmodifiableCollection(levels.values());
    }

    /** True if {@code price} ranks at or ahead of {@code other} on this side. */
    public boolean atOrBetter(long price, long other) {
        return side == Side.BUY ? price >= other : price <= other;
    }

    public boolean isEmpty() { return levels.isEmpty(); }

    public int levelCount() { return levels.size(); }

    public Side side() { return side; }

    /** Releases every level. Caller owns the orders. */
    public void clear() {
        for (PriceLevel level : levels.values()) levelPool.release(level);
        levels.clear();
    }

    private PriceLevel levelOf(Order o) {
        PriceLevel level = levels.get(o.price);
        if (level == null) throw new InvariantViolationException("No " + side + " level for " + o);
        return level;
    }

    private void dropIfEmpty(PriceLevel level) {
        if (level.isEmpty()) {
            levels.remove(level.price);
            levelPool.release(level);
        }
    }
}
