package com.orderbook.tools.feed;

import com.orderbook.common.LatencyStats;
import com.orderbook.engine.MatchingEngine;
import com.orderbook.protocol.OrderRequest;
import com.orderbook.protocol.OrderResult;
import com.orderbook.tools.feed.MarketDataMessage.CancelOrder;
import com.orderbook.tools.feed.MarketDataMessage.DepthSnapshot;
import com.orderbook.tools.feed.MarketDataMessage.ModifyOrder;
import com.orderbook.tools.feed.MarketDataMessage.NewOrder;
import com.orderbook.tools.feed.MarketDataMessage.TradePrint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies a sequenced market-data stream to a {@link MatchingEngine}.
 *
 * Messages must arrive with strictly increasing sequence numbers; anything else is
 * counted as a gap and refused without touching the book. Accepted messages are
 * dispatched through the engine's public operations only. A depth snapshot replaces
 * the whole book in one engine mutation, one GTC limit order per level.
 *
 * Not meant to be shared between feed threads, but safe if it is.
 */
public final class MarketDataProcessor {

    private static final Logger log = LoggerFactory.getLogger(MarketDataProcessor.class);

    private final MatchingEngine engine;
    private final LatencyStats latency = new LatencyStats("feed");

    private long lastSequence;
    private long messagesProcessed;
    private long newOrders;
    private long cancellations;
    private long modifications;
    private long trades;
    private long snapshots;
    private long sequenceGaps;
    private long errors;

    public MarketDataProcessor(MatchingEngine engine) {
        this.engine = engine;
    }

    /**
     * Apply one message.
     *
     * @return true if the engine accepted the message, false if it rejected it
     * @throws SequenceGapException if the sequence number does not advance the stream
     */
    public synchronized boolean process(MarketDataMessage msg) {
        long start = System.nanoTime();
        if (msg.sequence() <= lastSequence) {
            sequenceGaps++;
            log.warn("Dropping message seq={} type={}, last applied seq={}",
                    msg.sequence(), msg.getClass().getSimpleName(), lastSequence);
            throw new SequenceGapException(lastSequence + 1, msg.sequence());
        }
        lastSequence = msg.sequence();

        boolean accepted = dispatch(msg);

        latency.record(System.nanoTime() - start);
        messagesProcessed++;
        return accepted;
    }

    /** Apply messages in order. Gaps and rejects are counted and skipped. Returns how many were accepted. */
    public synchronized int processBatch(List<? extends MarketDataMessage> messages) {
        int accepted = 0;
        for (MarketDataMessage msg : messages) {
            try {
                if (process(msg)) {
                    accepted++;
                } else {
                    errors++;
                }
            } catch (SequenceGapException e) {
                errors++;
            }
        }
        return accepted;
    }

    private boolean dispatch(MarketDataMessage msg) {
        if (msg instanceof NewOrder m) {
            newOrders++;
            return accepted(msg, engine.submit(OrderRequest.of(m.orderId(), m.side(), m.type(), m.price(), m.quantity())));
        } else if (msg instanceof CancelOrder m) {
            cancellations++;
            return accepted(msg, engine.cancel(m.orderId()));
        } else if (msg instanceof ModifyOrder m) {
            modifications++;
            return accepted(msg, engine.modify(m.orderId(), m.newPrice(), m.newQuantity()));
        } else if (msg instanceof TradePrint) {
            trades++;
            return true;
        } else if (msg instanceof DepthSnapshot m) {
            snapshots++;
            return rebuild(m);
        }
        throw new IllegalArgumentException("Unknown message type: " + msg.getClass().getName());
    }

    private boolean rebuild(DepthSnapshot snap) {
        boolean ok = true;
        for (OrderResult result : engine.replaceBook(snap.bids(), snap.asks())) {
            ok &= accepted(snap, result);
        }
        log.debug("Rebuilt book from snapshot seq={}: bids={} asks={}",
                snap.sequence(), snap.bids().size(), snap.asks().size());
        return ok;
    }

    private boolean accepted(MarketDataMessage msg, OrderResult result) {
        if (result.isRejected()) {
            log.warn("Engine rejected feed message seq={}: {} order={}",
                    msg.sequence(), result.rejectReason(), result.orderId());
            return false;
        }
        return true;
    }

    public synchronized long lastSequence() {
        return lastSequence;
    }

    public synchronized FeedStatistics stats() {
        return new FeedStatistics(messagesProcessed, newOrders, cancellations, modifications, trades,
                snapshots, sequenceGaps, errors, lastSequence,
                latency.minNanos(), latency.maxNanos(), latency.meanNanos());
    }

    /** Zero the counters. The last applied sequence number is kept. */
    public synchronized void resetStats() {
        messagesProcessed = newOrders = cancellations = modifications = trades = snapshots = 0;
        sequenceGaps = errors = 0;
        latency.reset();
    }

    /** Log the processing latency distribution and start a new window. */
    public void logLatency() {
        latency.logAndReset();
    }
}
