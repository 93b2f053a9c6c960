package com.orderbook.tools.feed;

import com.orderbook.common.EngineConfig;
import com.orderbook.common.PriceUtil;
import com.orderbook.engine.MatchingEngine;
import com.orderbook.protocol.LevelView;
import com.orderbook.protocol.Side;
import com.orderbook.tools.BookPrinter;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Generates depth snapshots from a seeded random walk around a mid price and feeds
 * them through a {@link MarketDataProcessor}, printing the resulting book.
 *
 * Usage:
 *   java -cp ... com.orderbook.tools.feed.SyntheticFeed [config-path] [symbol] [interval-ms] [seed]
 */
public final class SyntheticFeed {

    private static final Logger log = LoggerFactory.getLogger(SyntheticFeed.class);

    private final Random rnd;
    private final Clock clock;
    private final long tick;
    private final int depth;
    private long mid;
    private long sequence;

    public SyntheticFeed(long seed, long startMid, long tick, int depth, Clock clock) {
        if (tick <= 0) throw new IllegalArgumentException("tick must be positive: " + tick);
        if (depth <= 0) throw new IllegalArgumentException("depth must be positive: " + depth);
        if (startMid <= tick * (depth + 1)) throw new IllegalArgumentException("mid too low for depth: " + startMid);
        this.rnd = new Random(seed);
        this.mid = startMid;
        this.tick = tick;
        this.depth = depth;
        this.clock = clock;
    }

    /** Move the mid by at most one tick and build a fresh, uncrossed depth snapshot around it. */
    public MarketDataMessage.DepthSnapshot next() {
        long floor = tick * (depth + 1);
        mid = Math.max(floor, mid + (rnd.nextInt(3) - 1) * tick);
        List<LevelView> bids = new ArrayList<>(depth);
        List<LevelView> asks = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            bids.add(new LevelView(mid - (i + 1) * tick, 1 + rnd.nextInt(500), 1));
            asks.add(new LevelView(mid + (i + 1) * tick, 1 + rnd.nextInt(500), 1));
        }
        return new MarketDataMessage.DepthSnapshot(++sequence, clock.instant(), bids, asks);
    }

    /** An informational trade print at the current mid. */
    public MarketDataMessage.TradePrint nextTrade() {
        Side aggressor = rnd.nextBoolean() ? Side.BUY : Side.SELL;
        return new MarketDataMessage.TradePrint(++sequence, clock.instant(), mid, 1 + rnd.nextInt(100), aggressor);
    }

    public long mid() {
        return mid;
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : null;
        String symbol     = args.length > 1 ? args[1] : "SYNTH";
        long intervalMs   = args.length > 2 ? Long.parseLong(args[2]) : 1_000;
        long seed         = args.length > 3 ? Long.parseLong(args[3]) : 42L;

        EngineConfig cfg = EngineConfig.load(configPath);
        MatchingEngine engine = new MatchingEngine(cfg);
        MarketDataProcessor processor = new MarketDataProcessor(engine);
        SyntheticFeed feed = new SyntheticFeed(seed, PriceUtil.ofUnits(100), PriceUtil.parse("0.01"),
                cfg.snapshotDepth, Clock.systemUTC());

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "synthetic-feed");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                processor.process(feed.next());
                processor.process(feed.nextTrade());
                BookPrinter.print(System.out, symbol, engine.snapshot(cfg.snapshotDepth));
            } catch (RuntimeException e) {
                log.warn("Feed update failed", e);
            }
        }, 0, intervalMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(processor::logLatency,
                cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);

        log.info("Synthetic feed for {} every {}ms (seed={}). Ctrl+C to stop.", symbol, intervalMs, seed);
        new ShutdownSignalBarrier().await();

        scheduler.shutdownNow();
        log.info("Feed stopped: {}", processor.stats());
    }
}
