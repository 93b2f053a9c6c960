package com.orderbook.engine.book;

import com.orderbook.protocol.LevelView;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;
import it.unimi.dsi.fastutil.longs.Long2IntMap;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Limit order book for a single instrument.
 *
 * Data structures:
 *   - bids: {@link BookSide} descending (best bid = first level)
 *   - asks: {@link BookSide} ascending  (best ask = first level)
 *   - index: {@link OrderIndex} orderId -> arena slot for O(1) cancel lookup
 *
 * Orders live in the {@link OrderPool} arena; levels chain them by slot. A resting
 * order is always in exactly one level and one index entry: every method here
 * updates both or neither.
 *
 * Not thread-safe. The owning engine serializes all access.
 */
public final class LimitOrderBook {

    public interface MatchCallback {
        /**
         * Called for each fill generated, after both quantities were reduced and
         * before a fully filled maker is released back to the pool.
         *
         * @param taker     the incoming order; {@code taker.qty} is its leaves qty
         * @param maker     the resting order; {@code maker.qty} is its leaves qty
         * @param fillPrice the maker's price
         * @param fillQty   executed quantity
         */
        void onFill(Order taker, Order maker, long fillPrice, long fillQty);
    }

    private final OrderPool orderPool;
    private final BookSide bids;
    private final BookSide asks;
    private final OrderIndex index;

    public LimitOrderBook(OrderPool orderPool) {
        this.orderPool = orderPool;
        PriceLevelPool levelPool = new PriceLevelPool(orderPool);
        this.bids = new BookSide(Side.BUY, levelPool);
        this.asks = new BookSide(Side.SELL, levelPool);
        this.index = new OrderIndex(Math.min(orderPool.capacity(), 1 << 16));
    }

    /**
     * Match an incoming order against the opposing side under price-time priority.
     * Reduces {@code taker.qty} in place; never rests the taker.
     */
    public void match(Order taker, MatchCallback cb) {
        BookSide opposite = sideOf(taker.side.opposite());
        while (taker.qty > 0) {
            PriceLevel level = opposite.peekBest();
            if (level == null || !crosses(taker, level.price)) break; // no cross
            matchLevel(taker, opposite, level, cb);
        }
    }

    private void matchLevel(Order taker, BookSide opposite, PriceLevel level, MatchCallback cb) {
        long price = level.price; // level is released once its last maker fills
        int slot = level.head;
        while (slot != Order.NIL && taker.qty > 0) {
            Order maker = orderPool.get(slot);
            int next = maker.next;
            long fillQty = Math.min(taker.qty, maker.qty);
            taker.qty -= fillQty;
            boolean filled = opposite.reduce(level, maker, fillQty);

            cb.onFill(taker, maker, price, fillQty);

            if (filled) {
                index.remove(maker.orderId);
                orderPool.release(maker);
            }
            slot = next;
        }
    }

    private static boolean crosses(Order taker, long restingPrice) {
        if (taker.type == OrderType.MARKET) return true;
        return taker.side == Side.BUY ? taker.price >= restingPrice : taker.price <= restingPrice;
    }

    /**
     * Read-only dry run of {@link #match}: quantity the opposing side could fill for
     * an order with this side, type and limit price. Stops scanning once
     * {@code needed} is reached.
     */
    public long matchableQuantity(Side takerSide, OrderType type, long limitPrice, long needed) {
        BookSide opposite = sideOf(takerSide.opposite());
        long available = 0;
        for (PriceLevel level : opposite.levels()) {
            if (type != OrderType.MARKET && !opposite.atOrBetter(level.price, limitPrice)) break;
            // saturate; the aggregate of several levels may exceed a long
            available = level.totalQty > Long.MAX_VALUE - available ? Long.MAX_VALUE : available + level.totalQty;
            if (available >= needed) break;
        }
        return available;
    }

    /** True if {@code qty} more can rest at {@code price} without overflowing the level aggregate. */
    public boolean levelHasRoom(Side side, long price, long qty) {
        PriceLevel level = sideOf(side).level(price);
        return level == null || level.totalQty <= Long.MAX_VALUE - qty;
    }

    /** Rest an order on its own side and register it in the index. */
    public void rest(Order o) {
        if (o.qty <= 0 || o.qty > o.origQty) throw new InvariantViolationException("Cannot rest " + o);
        index.put(o.orderId, o.slot);
        sideOf(o.side).insert(o);
    }

    /** Resting order by id, or null. */
    public Order find(long orderId) {
        int slot = index.slotOf(orderId);
        return slot == Order.NIL ? null : orderPool.get(slot);
    }

    public boolean contains(long orderId) {
        return index.contains(orderId);
    }

    /**
     * Take a resting order off the book (level and index). The order is not released;
     * the caller either releases it or re-enters it.
     * Returns null if no such resting order.
     */
    public Order unlink(long orderId) {
        int slot = index.remove(orderId);
        if (slot == Order.NIL) return null;
        Order o = orderPool.get(slot);
        sideOf(o.side).remove(o);
        return o;
    }

    /** Cancel by order id. Returns the cancelled remaining quantity, or -1 if not found. */
    public long cancel(long orderId) {
        Order o = unlink(orderId);
        if (o == null) return -1;
        long leaves = o.qty;
        orderPool.release(o);
        return leaves;
    }

    /**
     * Shrink a resting order in place, keeping its queue position. The original
     * quantity shrinks by the same amount so the filled quantity is unchanged.
     */
    public void reduceTo(Order o, long newQty) {
        if (newQty <= 0 || newQty > o.qty) throw new InvariantViolationException("Cannot reduce " + o + " to " + newQty);
        if (newQty == o.qty) return;
        long amount = o.qty - newQty;
        o.origQty -= amount;
        sideOf(o.side).reduce(o, amount);
    }

    /** Cancel every resting order matching the filter. Returns the number removed. */
    public int purge(Predicate<Order> filter) {
        List<Order> doomed = new ArrayList<>();
        collect(bids, filter, doomed);
        collect(asks, filter, doomed);
        for (Order o : doomed) {
            index.remove(o.orderId);
            sideOf(o.side).remove(o);
            orderPool.release(o);
        }
        return doomed.size();
    }

    private void collect(BookSide side, Predicate<Order> filter, List<Order> out) {
        for (PriceLevel level : side.levels()) {
            for (int slot = level.head; slot != Order.NIL; slot = orderPool.get(slot).next) {
                Order o = orderPool.get(slot);
                if (filter.test(o)) out.add(o);
            }
        }
    }

    /** Remove every resting order. */
    public int clear() {
        int removed = index.size();
        for (Long2IntMap.Entry e : index.entries()) {
            orderPool.release(orderPool.get(e.getIntValue()));
        }
        index.clear();
        bids.clear();
        asks.clear();
        return removed;
    }

    /** Best {@code maxLevels} levels of one side, best first. */
    public List<LevelView> depth(Side side, int maxLevels) {
        List<LevelView> out = new ArrayList<>(Math.min(maxLevels, 64));
        for (PriceLevel level : sideOf(side).levels()) {
            if (out.size() >= maxLevels) break;
            out.add(new LevelView(level.price, level.totalQty, level.orderCount));
        }
        return out;
    }

    /**
     * Full structural check. Throws {@link InvariantViolationException} on the first
     * inconsistency found.
     */
    public void verifyInvariants() {
        int resting = verifySide(bids) + verifySide(asks);
        if (resting != index.size()) {
            throw new InvariantViolationException("Levels hold " + resting + " orders, index holds " + index.size());
        }
        if (resting != orderPool.inUse()) {
            throw new InvariantViolationException(resting + " resting orders but " + orderPool.inUse() + " arena slots in use");
        }
        PriceLevel bestBid = bids.peekBest();
        PriceLevel bestAsk = asks.peekBest();
        if (bestBid != null && bestAsk != null && bestBid.price >= bestAsk.price) {
            throw new InvariantViolationException("Crossed book: bid " + bestBid.price + " >= ask " + bestAsk.price);
        }
    }

    private int verifySide(BookSide side) {
        int total = 0;
        long previousPrice = 0;
        boolean first = true;
        for (PriceLevel level : side.levels()) {
            if (!first && side.atOrBetter(level.price, previousPrice)) {
                throw new InvariantViolationException(side.side() + " levels out of order at " + level.price);
            }
            if (level.isEmpty()) throw new InvariantViolationException("Empty " + side.side() + " level at " + level.price);
            long sum = 0;
            int count = 0;
            int prev = Order.NIL;
            for (int slot = level.head; slot != Order.NIL; slot = orderPool.get(slot).next) {
                Order o = orderPool.get(slot);
                if (!o.inUse) throw new InvariantViolationException("Free slot " + slot + " linked at " + level.price);
                if (o.prev != prev) throw new InvariantViolationException("Broken back link at " + o);
                if (o.side != side.side() || o.price != level.price) {
                    throw new InvariantViolationException(o + " filed under " + side.side() + " " + level.price);
                }
                if (o.qty <= 0 || o.qty > o.origQty) throw new InvariantViolationException("Bad quantity " + o);
                if (index.slotOf(o.orderId) != slot) throw new InvariantViolationException("Index mismatch for " + o);
                sum += o.qty;
                count++;
                prev = slot;
            }
            if (prev != level.tail) throw new InvariantViolationException("Tail mismatch at " + level.price);
            if (sum != level.totalQty) {
                throw new InvariantViolationException("Aggregate " + level.totalQty + " != member sum " + sum + " at " + level.price);
            }
            if (count != level.orderCount) {
                throw new InvariantViolationException("Order count " + level.orderCount + " != " + count + " at " + level.price);
            }
            total += count;
            previousPrice = level.price;
            first = false;
        }
        return total;
    }

    public BookSide sideOf(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    public long bestBid() { return bids.isEmpty() ? Long.MIN_VALUE : bids.peekBest().price; }
    public long bestAsk() { return asks.isEmpty() ? Long.MAX_VALUE : asks.peekBest().price; }

    public int bidLevels() { return bids.levelCount(); }
    public int askLevels() { return asks.levelCount(); }

    public int size() { return index.size(); }
}
