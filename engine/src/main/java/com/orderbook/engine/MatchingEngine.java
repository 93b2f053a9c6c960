package com.orderbook.engine;

import com.orderbook.common.EngineConfig;
import com.orderbook.engine.book.InvariantViolationException;
import com.orderbook.engine.book.LimitOrderBook;
import com.orderbook.engine.book.Order;
import com.orderbook.engine.book.OrderPool;
import com.orderbook.protocol.BookSnapshot;
import com.orderbook.protocol.EngineStatistics;
import com.orderbook.protocol.LevelView;
import com.orderbook.protocol.OrderRequest;
import com.orderbook.protocol.OrderResult;
import com.orderbook.protocol.OrderStatus;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.RejectReason;
import com.orderbook.protocol.Side;
import com.orderbook.protocol.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe matching engine for a single instrument.
 *
 * Every mutation (submit, cancel, modify, clear, day reset) runs under the write
 * lock as one critical section, so callers observe book changes in a single total
 * order. Snapshots and best prices take the read lock for one consistent copy.
 * Statistics live in a separately synchronized accumulator, updated before the
 * write lock is released so every operation lands in the day it executed in.
 *
 * Modify policy: same price with a quantity that does not increase shrinks the order
 * in place and keeps its queue position; any other change is an atomic
 * cancel-then-resubmit that joins the tail of the new level under the same id.
 */
public final class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final boolean checkInvariants;
    private final OrderPool orderPool;
    private final LimitOrderBook book;
    private final EngineStats stats;
    private final AtomicLong orderIdGen = new AtomicLong(1);

    // Guarded by lock
    private DayResetPolicy dayResetPolicy;
    private Instant lastDayReset;
    private long sequence;
    private long nextTradeId = 1;

    public MatchingEngine(EngineConfig cfg) {
        this(cfg, Clock.system(cfg.zoneId()));
    }

    public MatchingEngine(EngineConfig cfg, Clock clock) {
        cfg.validate();
        this.clock = clock;
        this.checkInvariants = cfg.checkInvariants;
        this.orderPool = new OrderPool(cfg.orderPoolSize);
        this.book = new LimitOrderBook(orderPool);
        this.dayResetPolicy = DayResetPolicy.from(cfg);
        this.lastDayReset = clock.instant();
        this.stats = new EngineStats(lastDayReset);
    }

    /** Fresh id, unique among ids handed out by this engine. */
    public long nextOrderId() {
        return orderIdGen.getAndIncrement();
    }

    /**
     * Submit a new order. Returns the trades generated (maker price, earliest first)
     * and what happened to the remainder.
     */
    public OrderResult submit(OrderRequest req) {
        long start = System.nanoTime();
        OrderResult result;
        lock.writeLock().lock();
        try {
            result = doSubmit(req);
            if (!result.isRejected()) afterMutation();
            stats.onSubmit(System.nanoTime() - start, result.trades().size(), result.filledQuantity(), result.isRejected());
        } finally {
            lock.writeLock().unlock();
        }
        return result;
    }

    private OrderResult doSubmit(OrderRequest req) {
        RejectReason reason = validate(req);
        if (reason == null && book.contains(req.orderId())) reason = RejectReason.DUPLICATE_ORDER_ID;
        if (reason == null && req.type().canRest() && !book.levelHasRoom(req.side(), req.price(), req.quantity())) {
            reason = RejectReason.INVALID_QUANTITY;
        }
        if (reason == null && req.type() == OrderType.FOK
                && book.matchableQuantity(req.side(), req.type(), req.price(), req.quantity()) < req.quantity()) {
            reason = RejectReason.FILL_OR_KILL_UNSATISFIED;
        }
        if (reason != null) return reject(req.orderId(), reason);

        Order order = orderPool.borrow();
        if (order == null) {
            log.warn("Order arena exhausted ({} slots), rejecting order {}", orderPool.capacity(), req.orderId());
            return reject(req.orderId(), RejectReason.SYSTEM_BUSY);
        }
        order.orderId   = req.orderId();
        order.side      = req.side();
        order.type      = req.type();
        order.price     = req.type() == OrderType.MARKET ? 0 : req.price();
        order.qty       = req.quantity();
        order.origQty   = req.quantity();
        order.owner     = req.owner();
        order.createdAt = clock.instant();

        return execute(order);
    }

    private static RejectReason validate(OrderRequest req) {
        if (req.orderId() <= 0) return RejectReason.INVALID_ORDER_ID;
        if (req.quantity() <= 0) return RejectReason.INVALID_QUANTITY;
        if (req.type().requiresPrice() && req.price() <= 0) return RejectReason.INVALID_PRICE;
        return null;
    }

    /** Match, then rest or discard the remainder. Consumes {@code order}. */
    private OrderResult execute(Order order) {
        long orderId = order.orderId;
        List<Trade> trades = new ArrayList<>();
        Instant now = clock.instant();
        book.match(order, (taker, maker, fillPrice, fillQty) -> trades.add(toTrade(taker, maker, fillPrice, fillQty, now)));

        long filled = order.filledQty();
        long leaves = order.qty;
        OrderStatus status;
        if (leaves == 0) {
            status = OrderStatus.FILLED;
            orderPool.release(order);
        } else if (order.type.canRest()) {
            book.rest(order);
            status = filled > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.RESTING;
        } else {
            // MARKET / IOC: discard remainder. A FOK never gets here unfilled.
            if (order.type == OrderType.FOK) {
                throw new InvariantViolationException("FOK " + orderId + " left " + leaves + " after pre-check");
            }
            status = OrderStatus.CANCELLED;
            orderPool.release(order);
        }
        if (log.isDebugEnabled()) {
            log.debug("Order {} {}: filled={} leaves={} trades={}", orderId, status, filled, leaves, trades.size());
        }
        return new OrderResult(orderId, status, null, trades, filled, leaves);
    }

    private Trade toTrade(Order taker, Order maker, long price, long qty, Instant now) {
        long buyId  = taker.side == Side.BUY ? taker.orderId : maker.orderId;
        long sellId = taker.side == Side.BUY ? maker.orderId : taker.orderId;
        return new Trade(nextTradeId++, buyId, sellId, taker.side, price, qty, now);
    }

    /** Cancel a resting order. Unknown or already removed ids report ORDER_NOT_FOUND. */
    public OrderResult cancel(long orderId) {
        long start = System.nanoTime();
        OrderResult result;
        lock.writeLock().lock();
        try {
            long leaves = book.cancel(orderId);
            if (leaves < 0) {
                result = reject(orderId, RejectReason.ORDER_NOT_FOUND);
            } else {
                log.debug("Order {} cancelled, leaves={}", orderId, leaves);
                result = OrderResult.cancelled(orderId, leaves);
                afterMutation();
            }
            stats.onCancel(System.nanoTime() - start, result.isRejected());
        } finally {
            lock.writeLock().unlock();
        }
        return result;
    }

    /**
     * Change price and/or quantity of a resting order. {@code newQuantity} is the new
     * remaining quantity.
     */
    public OrderResult modify(long orderId, long newPrice, long newQuantity) {
        long start = System.nanoTime();
        OrderResult result;
        lock.writeLock().lock();
        try {
            result = doModify(orderId, newPrice, newQuantity);
            if (!result.isRejected()) afterMutation();
            stats.onModify(System.nanoTime() - start, result.trades().size(), result.filledQuantity(), result.isRejected());
        } finally {
            lock.writeLock().unlock();
        }
        return result;
    }

    private OrderResult doModify(long orderId, long newPrice, long newQuantity) {
        Order order = book.find(orderId);
        if (order == null) return reject(orderId, RejectReason.ORDER_NOT_FOUND);
        if (newQuantity <= 0) return reject(orderId, RejectReason.INVALID_QUANTITY);
        if (newPrice <= 0) return reject(orderId, RejectReason.INVALID_PRICE);

        if (newPrice == order.price && newQuantity <= order.qty) {
            book.reduceTo(order, newQuantity);
            log.debug("Order {} reduced in place to {}", orderId, newQuantity);
            long filled = order.filledQty();
            return new OrderResult(orderId, filled > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.RESTING,
                    null, List.of(), filled, newQuantity);
        }
        long alreadyAtLevel = newPrice == order.price ? order.qty : 0;
        if (!book.levelHasRoom(order.side, newPrice, newQuantity - alreadyAtLevel)) {
            return reject(orderId, RejectReason.INVALID_QUANTITY);
        }

        // Loses time priority: leave the level, re-enter as a fresh order with the same id
        book.unlink(orderId);
        order.price     = newPrice;
        order.qty       = newQuantity;
        order.origQty   = newQuantity;
        order.createdAt = clock.instant();
        log.debug("Order {} replaced: price={} qty={}", orderId, newPrice, newQuantity);
        return execute(order);
    }

    /** Cancel all GFD orders and reset the statistics. Returns the number of orders purged. */
    public int resetDay() {
        lock.writeLock().lock();
        try {
            return doResetDay(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Scheduled maintenance tick: performs the day reset if the configured boundary
     * was crossed since the last one. Returns the number of orders purged, or -1 if
     * no reset was due.
     */
    public int runMaintenance() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (!dayResetPolicy.isDue(lastDayReset, now)) return -1;
            return doResetDay(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int doResetDay(Instant now) {
        int purged = book.purge(o -> o.type == OrderType.GFD);
        lastDayReset = now;
        stats.reset(now);
        afterMutation();
        log.info("Day reset at {}: {} GFD orders cancelled, {} orders still resting", now, purged, book.size());
        return purged;
    }

    /** @throws IllegalArgumentException unless 0-23 / 0-59 */
    public void setDayResetTime(int hour, int minute) {
        DayResetPolicy policy = new DayResetPolicy(hour, minute, dayResetPolicy().zone());
        lock.writeLock().lock();
        try {
            dayResetPolicy = policy;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Day reset boundary set to {}", policy);
    }

    /** Remove every resting order. Returns the number removed. */
    public int clear() {
        lock.writeLock().lock();
        try {
            int removed = book.clear();
            afterMutation();
            log.debug("Book cleared, {} orders removed", removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the whole book with one GTC order per level, as a single mutation.
     * Readers see either the old book or the complete new one. Levels are entered
     * bids first, best first; a crossed input trades against itself like any submit.
     * Returns one result per level, in input order.
     */
    public List<OrderResult> replaceBook(List<LevelView> bids, List<LevelView> asks) {
        lock.writeLock().lock();
        try {
            int removed = book.clear();
            List<OrderResult> results = new ArrayList<>(bids.size() + asks.size());
            enterLevels(Side.BUY, bids, results);
            enterLevels(Side.SELL, asks, results);
            afterMutation();
            log.debug("Book replaced: removed={} bids={} asks={} resting={}", removed, bids.size(), asks.size(), book.size());
            return results;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void enterLevels(Side side, List<LevelView> levels, List<OrderResult> out) {
        String owner = side == Side.BUY ? "level-bid-" : "level-ask-";
        for (int i = 0; i < levels.size(); i++) {
            long start = System.nanoTime();
            LevelView level = levels.get(i);
            OrderResult r = doSubmit(new OrderRequest(nextOrderId(), side, OrderType.GTC,
                    level.price(), level.quantity(), owner + i));
            stats.onSubmit(System.nanoTime() - start, r.trades().size(), r.filledQuantity(), r.isRejected());
            out.add(r);
        }
    }

    /** Best {@code depth} levels per side, consistent with a single moment of the book. */
    public BookSnapshot snapshot(int depth) {
        if (depth < 0) throw new IllegalArgumentException("depth must not be negative: " + depth);
        lock.readLock().lock();
        try {
            return new BookSnapshot(book.depth(Side.BUY, depth), book.depth(Side.SELL, depth), sequence, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    public EngineStatistics stats() {
        return stats.snapshot();
    }

    public OptionalLong bestBid() {
        lock.readLock().lock();
        try {
            return book.bidLevels() == 0 ? OptionalLong.empty() : OptionalLong.of(book.bestBid());
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalLong bestAsk() {
        lock.readLock().lock();
        try {
            return book.askLevels() == 0 ? OptionalLong.empty() : OptionalLong.of(book.bestAsk());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int restingOrders() {
        lock.readLock().lock();
        try {
            return book.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** @throws InvariantViolationException if the book structures disagree */
    public void verifyInvariants() {
        lock.readLock().lock();
        try {
            checkBook();
        } finally {
            lock.readLock().unlock();
        }
    }

    public DayResetPolicy dayResetPolicy() {
        lock.readLock().lock();
        try {
            return dayResetPolicy;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void afterMutation() {
        sequence++;
        if (checkInvariants) checkBook();
    }

    private void checkBook() {
        try {
            book.verifyInvariants();
        } catch (InvariantViolationException e) {
            log.error("Book invariant violated at sequence {}", sequence, e);
            throw e;
        }
    }

    private OrderResult reject(long orderId, RejectReason reason) {
        log.debug("Order {} rejected: {}", orderId, reason);
        return OrderResult.rejected(orderId, reason);
    }
}
