package com.orderbook.engine.book;

/**
 * Fixed-capacity arena of {@link Order} objects addressed by slot.
 * Pre-allocates all orders at construction; no allocation in hot path.
 * Price levels and the order index hold slots, never order references.
 */
public final class OrderPool {

    private final Order[] slots;
    private final int[] free;
    private int top;

    public OrderPool(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        slots = new Order[capacity];
        free = new int[capacity];
        for (int i = 0; i < capacity; i++) {
            slots[i] = new Order(i);
            free[i] = capacity - 1 - i; // lowest slot handed out first
        }
        top = capacity;
    }

    /** Borrow an order from the pool. Returns null if pool is exhausted. */
    public Order borrow() {
        if (top == 0) return null;
        Order o = slots[free[--top]];
        o.reset();
        o.inUse = true;
        return o;
    }

    /** Return an order to the pool. */
    public void release(Order o) {
        if (!o.inUse) throw new InvariantViolationException("Order slot " + o.slot + " released twice");
        o.reset();
        o.inUse = false;
        free[top++] = o.slot;
    }

    public Order get(int slot) {
        return slots[slot];
    }

    public int available() { return top; }

    public int capacity() { return slots.length; }

    public int inUse() { return slots.length - top; }
}
