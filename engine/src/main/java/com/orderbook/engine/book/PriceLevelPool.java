package com.orderbook.engine.book;

public final class PriceLevelPool {
    private final PriceLevel[] pool;
    private int top;

    /**
     * Every live level holds at least one order, so a level pool sized to the
     * order arena can never run dry.
     */
    public PriceLevelPool(OrderPool orders) {
        pool = new PriceLevel[orders.capacity()];
        for (int i = 0; i < pool.length; i++) pool[i] = new PriceLevel(orders);
        top = pool.length;
    }

    public PriceLevel borrow(long price) {
        if (top == 0) throw new InvariantViolationException("PriceLevelPool exhausted");
        PriceLevel pl = pool[--top];
        pl.reset();
        pl.price = price;
        return pl;
    }

    public void release(PriceLevel pl) {
        pl.reset();
        pool[top++] = pl;
    }

    public int available() { return top; }
}
