package com.orderbook.engine.book;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * orderId -> arena slot for every resting order. The slot's order carries side and
 * price, which locate its level; the slot links give O(1) unlink inside it.
 */
public final class OrderIndex {

    private final Long2IntOpenHashMap slots;

    public OrderIndex(int expected) {
        slots = new Long2IntOpenHashMap(expected);
        slots.defaultReturnValue(Order.NIL);
    }

    public void put(long orderId, int slot) {
        int previous = slots.put(orderId, slot);
        if (previous != Order.NIL) {
            slots.put(orderId, previous);
            throw new InvariantViolationException("Order " + orderId + " already indexed at slot " + previous);
        }
    }

    /** Slot of a resting order, or {@link Order#NIL}. */
    public int slotOf(long orderId) {
        return slots.get(orderId);
    }

    public int remove(long orderId) {
        return slots.remove(orderId);
    }

    public boolean contains(long orderId) {
        return slots.containsKey(orderId);
    }

    public int size() { return slots.size(); }

    public void clear() { slots.clear(); }

    Iterable<Long2IntMap.Entry> entries() {
        return slots.long2IntEntrySet();
    }
}
