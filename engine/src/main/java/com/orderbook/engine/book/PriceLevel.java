package com.orderbook.engine.book;

/**
 * FIFO queue of orders at a single price, linked by arena slot.
 * Head = oldest (first to match). Tail = newest.
 * totalQty is the sum of the members' remaining quantity after every mutation.
 */
public final class PriceLevel {

    private final OrderPool orders;

    public long price;
    public long totalQty;
    public int orderCount;
    public int head = Order.NIL;
    public int tail = Order.NIL;

    PriceLevel(OrderPool orders) {
        this.orders = orders;
    }

    public void reset() {
        price = 0;
        totalQty = 0;
        orderCount = 0;
        head = Order.NIL;
        tail = Order.NIL;
    }

    public void addOrder(Order o) {
        o.prev = tail;
        o.next = Order.NIL;
        if (tail != Order.NIL) orders.get(tail).next = o.slot;
        else head = o.slot;
        tail = o.slot;
        totalQty = Math.addExact(totalQty, o.qty);
        orderCount++;
    }

    /** O(1) unlink from any position. */
    public void removeOrder(Order o) {
        if (o.prev != Order.NIL) orders.get(o.prev).next = o.next;
        else head = o.next;
        if (o.next != Order.NIL) orders.get(o.next).prev = o.prev;
        else tail = o.prev;
        totalQty -= o.qty;
        orderCount--;
        o.prev = Order.NIL;
        o.next = Order.NIL;
    }

    public Order first() {
        return head == Order.NIL ? null : orders.get(head);
    }

    public boolean isEmpty() { return head == Order.NIL; }
}
