package com.orderbook.engine.book;

import com.orderbook.protocol.LevelView;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LimitOrderBookTest {

    private static final long PRICE_SCALE = 1_000_000L;

    private OrderPool orderPool;
    private LimitOrderBook book;

    // Fill records captured during matching
    record FillEvent(long takerId, long makerId, long price, long qty,
                     long takerLeaves, long makerLeaves) {}

    private final List<FillEvent> fills = new ArrayList<>();

    private final LimitOrderBook.MatchCallback cb = (taker, maker, fillPrice, fillQty) ->
            fills.add(new FillEvent(taker.orderId, maker.orderId, fillPrice, fillQty, taker.qty, maker.qty));

    @BeforeEach
    void setUp() {
        orderPool = new OrderPool(1_000);
        book      = new LimitOrderBook(orderPool);
        fills.clear();
    }

    @AfterEach
    void checkStructure() {
        book.verifyInvariants();
    }

    // -----------------------------------------------------------------------
    // Two crossing limit orders -> full fill, book empty
    // -----------------------------------------------------------------------
    @Test
    void testFullCross_buyAggressor() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 50));
        assertTrue(fills.isEmpty(), "No fills yet, passive side");

        Order buy = add(makeOrder(2, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 50));

        assertEquals(1, fills.size(), "Exactly one fill event");
        FillEvent f = fills.get(0);
        assertEquals(2,                 f.takerId());
        assertEquals(1,                 f.makerId());
        assertEquals(100 * PRICE_SCALE, f.price());
        assertEquals(50,                f.qty());
        assertEquals(0,                 f.takerLeaves());
        assertEquals(0,                 f.makerLeaves());
        assertNull(buy, "Fully filled taker does not rest");

        assertEquals(Long.MIN_VALUE, book.bestBid());
        assertEquals(Long.MAX_VALUE, book.bestAsk());
        assertEquals(0, book.size());
    }

    // -----------------------------------------------------------------------
    // Partial fill, remainder rests
    // -----------------------------------------------------------------------
    @Test
    void testPartialFill_restRemainder() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 30));
        add(makeOrder(2, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 100));

        assertEquals(1, fills.size());
        FillEvent f = fills.get(0);
        assertEquals(30, f.qty());
        assertEquals(70, f.takerLeaves(), "Buy should have 70 remaining");
        assertEquals(0,  f.makerLeaves(), "Sell fully filled");

        assertEquals(100 * PRICE_SCALE, book.bestBid());
        assertEquals(Long.MAX_VALUE, book.bestAsk(), "Ask side empty");
        assertEquals(List.of(new LevelView(100 * PRICE_SCALE, 70, 1)), book.depth(Side.BUY, 5));
    }

    // -----------------------------------------------------------------------
    // Trade prints at the maker's price, not the taker's limit
    // -----------------------------------------------------------------------
    @Test
    void testTradeAtMakerPrice() {
        add(makeOrder(1, Side.BUY, OrderType.LIMIT, 100 * PRICE_SCALE, 10));
        add(makeOrder(2, Side.SELL, OrderType.LIMIT, 99 * PRICE_SCALE, 4));

        assertEquals(1, fills.size());
        assertEquals(100 * PRICE_SCALE, fills.get(0).price(), "Maker bid price wins");
        assertEquals(4, fills.get(0).qty());
        assertEquals(6, book.depth(Side.BUY, 1).get(0).quantity());
    }

    // -----------------------------------------------------------------------
    // FIFO: two resting sells at same price fill in arrival order
    // -----------------------------------------------------------------------
    @Test
    void testFifoWithinPriceLevel() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 20));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 20));

        add(makeOrder(3, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 30));

        assertEquals(2, fills.size(), "Should generate 2 fill events");
        assertEquals(1, fills.get(0).makerId(), "First passive should be sell1");
        assertEquals(20, fills.get(0).qty());
        assertEquals(2, fills.get(1).makerId(), "Second passive should be sell2");
        assertEquals(10, fills.get(1).qty());

        // Partially filled order 2 keeps the head of the queue
        add(makeOrder(4, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 5));
        fills.clear();
        add(makeOrder(5, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 12));
        assertEquals(2, fills.get(0).makerId(), "No reordering on partial fill");
        assertEquals(4, fills.get(1).makerId());
    }

    // -----------------------------------------------------------------------
    // Price priority: better price fills first regardless of arrival
    // -----------------------------------------------------------------------
    @Test
    void testPricePriority() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 101 * PRICE_SCALE, 10));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 99  * PRICE_SCALE, 10));

        add(makeOrder(3, Side.BUY, OrderType.GTC, 105 * PRICE_SCALE, 10));

        assertEquals(1, fills.size());
        assertEquals(99 * PRICE_SCALE, fills.get(0).price(), "Should fill at 99, not 101");
        assertEquals(2,                fills.get(0).makerId());
        assertEquals(101 * PRICE_SCALE, book.bestAsk(), "101 ask should still rest");
    }

    @Test
    void testSellSweepsBidsBestFirst() {
        add(makeOrder(1, Side.BUY, OrderType.GTC, 98 * PRICE_SCALE, 5));
        add(makeOrder(2, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 5));
        add(makeOrder(3, Side.BUY, OrderType.GTC, 99 * PRICE_SCALE, 5));

        add(makeOrder(4, Side.SELL, OrderType.GTC, 99 * PRICE_SCALE, 20));

        assertEquals(2, fills.size());
        assertEquals(100 * PRICE_SCALE, fills.get(0).price());
        assertEquals(99 * PRICE_SCALE,  fills.get(1).price());
        assertEquals(98 * PRICE_SCALE, book.bestBid());
        assertEquals(99 * PRICE_SCALE, book.bestAsk(), "Remainder 10 rests at its limit");
    }

    // -----------------------------------------------------------------------
    // Market order crosses any price
    // -----------------------------------------------------------------------
    @Test
    void testMarketWalksLevels() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 5));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE + 500_000, 5));

        Order market = makeOrder(3, Side.BUY, OrderType.MARKET, 0, 8);
        book.match(market, cb);

        assertEquals(2, fills.size());
        assertEquals(5, fills.get(0).qty());
        assertEquals(3, fills.get(1).qty());
        assertEquals(0, market.qty);
        assertEquals(List.of(new LevelView(100 * PRICE_SCALE + 500_000, 2, 1)), book.depth(Side.SELL, 10));
        orderPool.release(market);
    }

    // -----------------------------------------------------------------------
    // Dry-run scan for fill-or-kill
    // -----------------------------------------------------------------------
    @Test
    void testMatchableQuantityRespectsLimit() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 10));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 5));
        add(makeOrder(3, Side.SELL, OrderType.GTC, 102 * PRICE_SCALE, 50));

        assertEquals(15, book.matchableQuantity(Side.BUY, OrderType.FOK, 101 * PRICE_SCALE, 20));
        assertEquals(65, book.matchableQuantity(Side.BUY, OrderType.FOK, 102 * PRICE_SCALE, 100));
        assertEquals(0,  book.matchableQuantity(Side.BUY, OrderType.FOK, 99 * PRICE_SCALE, 1));
        assertEquals(0,  book.matchableQuantity(Side.SELL, OrderType.FOK, 1, 1), "Empty bid side");
        assertEquals(15, book.matchableQuantity(Side.BUY, OrderType.FOK, 102 * PRICE_SCALE, 12),
                "Scan stops once enough is found");
        assertTrue(fills.isEmpty(), "Dry run never fills");
        assertEquals(3, book.size());
    }

    @Test
    void testMatchableQuantitySaturatesAcrossHugeLevels() {
        long half = Long.MAX_VALUE / 2 + 1;
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, half));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 101 * PRICE_SCALE, half));

        assertEquals(Long.MAX_VALUE, book.matchableQuantity(Side.BUY, OrderType.FOK, 101 * PRICE_SCALE, Long.MAX_VALUE),
                "Sum of both levels exceeds a long and must not wrap negative");
        assertEquals(half, book.matchableQuantity(Side.BUY, OrderType.FOK, 100 * PRICE_SCALE, Long.MAX_VALUE));
    }

    @Test
    void testLevelHasRoom() {
        long half = Long.MAX_VALUE / 2 + 1;
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, half));

        assertFalse(book.levelHasRoom(Side.SELL, 100 * PRICE_SCALE, half), "Aggregate would overflow");
        assertTrue(book.levelHasRoom(Side.SELL, 100 * PRICE_SCALE, Long.MAX_VALUE - half));
        assertTrue(book.levelHasRoom(Side.SELL, 101 * PRICE_SCALE, Long.MAX_VALUE), "Empty level");
        assertTrue(book.levelHasRoom(Side.BUY, 100 * PRICE_SCALE, Long.MAX_VALUE), "Other side untouched");
    }

    // -----------------------------------------------------------------------
    // Cancel removes order from level and index
    // -----------------------------------------------------------------------
    @Test
    void testCancelOrder() {
        add(makeOrder(1, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 50));
        assertEquals(100 * PRICE_SCALE, book.bestBid());

        assertEquals(50, book.cancel(1), "Cancel returns the leaves qty");
        assertEquals(Long.MIN_VALUE, book.bestBid(), "Book should be empty after cancel");
        assertEquals(-1, book.cancel(1), "Second cancel reports not found");
        assertEquals(orderPool.capacity(), orderPool.available(), "Slot returned to the arena");
    }

    @Test
    void testCancelFromMiddleOfQueue() {
        add(makeOrder(1, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 1));
        add(makeOrder(2, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 2));
        add(makeOrder(3, Side.SELL, OrderType.GTC, 100 * PRICE_SCALE, 3));

        book.cancel(2);
        assertEquals(List.of(new LevelView(100 * PRICE_SCALE, 4, 2)), book.depth(Side.SELL, 1));

        add(makeOrder(4, Side.BUY, OrderType.IOC, 100 * PRICE_SCALE, 10));
        assertEquals(List.of(1L, 3L), fills.stream().map(FillEvent::makerId).toList());
    }

    @Test
    void testReduceKeepsQueuePosition() {
        add(makeOrder(1, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 10));
        add(makeOrder(2, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 10));

        book.reduceTo(book.find(1), 4);
        assertEquals(14, book.depth(Side.BUY, 1).get(0).quantity());
        assertEquals(0, book.find(1).filledQty(), "A reduction is not a fill");

        add(makeOrder(3, Side.SELL, OrderType.IOC, 100 * PRICE_SCALE, 5));
        assertEquals(1, fills.get(0).makerId(), "Reduced order still first");
        assertEquals(4, fills.get(0).qty());
        assertThrows(InvariantViolationException.class, () -> book.reduceTo(book.find(2), 50));
    }

    @Test
    void testPurgeByFilter() {
        add(makeOrder(1, Side.BUY,  OrderType.GFD, 99 * PRICE_SCALE, 10));
        add(makeOrder(2, Side.BUY,  OrderType.GTC, 99 * PRICE_SCALE, 10));
        add(makeOrder(3, Side.SELL, OrderType.GFD, 101 * PRICE_SCALE, 10));
        add(makeOrder(4, Side.SELL, OrderType.LIMIT, 102 * PRICE_SCALE, 10));

        assertEquals(2, book.purge(o -> o.type == OrderType.GFD));
        assertFalse(book.contains(1));
        assertFalse(book.contains(3));
        assertEquals(102 * PRICE_SCALE, book.bestAsk(), "GFD level emptied and dropped");
        assertEquals(2, book.size());
    }

    @Test
    void testClearReleasesEverything() {
        for (int i = 1; i <= 20; i++) {
            add(makeOrder(i, i % 2 == 0 ? Side.BUY : Side.SELL, OrderType.GTC,
                    (i % 2 == 0 ? 90 + i % 5 : 110 + i % 5) * PRICE_SCALE, i));
        }
        assertEquals(20, book.clear());
        assertEquals(0, book.size());
        assertEquals(0, book.bidLevels());
        assertEquals(0, book.askLevels());
        assertEquals(orderPool.capacity(), orderPool.available());
    }

    // -----------------------------------------------------------------------
    // Invariant checker catches corruption
    // -----------------------------------------------------------------------
    @Test
    void testVerifyInvariantsDetectsAggregateMismatch() {
        add(makeOrder(1, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 10));
        PriceLevel level = book.sideOf(Side.BUY).level(100 * PRICE_SCALE);
        level.totalQty += 1;

        assertThrows(InvariantViolationException.class, book::verifyInvariants);
        level.totalQty -= 1; // restore for @AfterEach
    }

    @Test
    void testDuplicateRestIsAnInvariantViolation() {
        add(makeOrder(1, Side.BUY, OrderType.GTC, 100 * PRICE_SCALE, 10));
        Order dup = makeOrder(1, Side.BUY, OrderType.GTC, 101 * PRICE_SCALE, 10);

        assertThrows(InvariantViolationException.class, () -> book.rest(dup));
        orderPool.release(dup);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /** Match then rest like a limit order; returns the order if it rested. */
    private Order add(Order o) {
        book.match(o, cb);
        if (o.qty == 0 || !o.type.canRest()) {
            orderPool.release(o);
            return null;
        }
        book.rest(o);
        return o;
    }

    private Order makeOrder(long id, Side side, OrderType type, long price, long qty) {
        Order o = orderPool.borrow();
        assertNotNull(o, "Pool exhausted");
        o.orderId   = id;
        o.side      = side;
        o.type      = type;
        o.price     = price;
        o.qty       = qty;
        o.origQty   = qty;
        o.createdAt = Instant.EPOCH;
        return o;
    }
}
