package com.orderbook.tools;

import com.orderbook.common.EngineConfig;
import com.orderbook.engine.MatchingEngine;
import com.orderbook.protocol.EngineStatistics;
import com.orderbook.protocol.OrderRequest;
import com.orderbook.protocol.OrderResult;
import com.orderbook.protocol.OrderType;
import com.orderbook.protocol.Side;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process load generator. Writer threads submit a deterministic mix of limit,
 * market and IOC orders plus cancels against one engine while a reader thread
 * takes snapshots. Measures per-call latency with HdrHistogram.
 *
 * Usage:
 *   java -cp ... com.orderbook.tools.LoadGenerator [config-path] [writer-threads] [orders-per-thread]
 */
public final class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final long MID  = 100_000_000L;  // 100.00
    private static final long TICK = 10_000L;       // 0.01

    private final MatchingEngine engine;
    private final int writers;
    private final int ordersPerWriter;

    private final AtomicLong snapshotCount = new AtomicLong();
    private final AtomicLong rejectCount   = new AtomicLong();

    public LoadGenerator(MatchingEngine engine, int writers, int ordersPerWriter) {
        this.engine = engine;
        this.writers = writers;
        this.ordersPerWriter = ordersPerWriter;
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        int threads       = args.length > 1 ? Integer.parseInt(args[1]) : 4;
        int perThread     = args.length > 2 ? Integer.parseInt(args[2]) : 250_000;

        EngineConfig cfg = EngineConfig.load(configPath);
        MatchingEngine engine = new MatchingEngine(cfg);
        LoadGenerator gen = new LoadGenerator(engine, threads, perThread);

        log.info("Starting load: {} writers x {} orders, pool={}", threads, perThread, cfg.orderPoolSize);
        Result result = gen.run();
        result.print();
        BookPrinter.print(System.out, "LOADGEN", engine.snapshot(cfg.snapshotDepth));
    }

    /** Summary of one run. */
    public record Result(long operations, long rejects, long snapshots, long elapsedNanos,
                         Histogram latency, EngineStatistics engineStats) {

        public double opsPerSecond() {
            return elapsedNanos == 0 ? 0 : operations * 1_000_000_000.0 / elapsedNanos;
        }

        public void print() {
            System.out.printf("%n=== Load Generator Results ===%n");
            System.out.printf("Operations:  %d in %.2f s (%.0f ops/s)%n", operations, elapsedNanos / 1e9, opsPerSecond());
            System.out.printf("Rejects:     %d%n", rejects);
            System.out.printf("Snapshots:   %d%n", snapshots);
            System.out.printf("Trades:      %d (volume %d)%n", engineStats.tradesExecuted(), engineStats.volumeTraded());
            System.out.printf("Latency p50: %.1f µs%n", latency.getValueAtPercentile(50) / 1_000.0);
            System.out.printf("Latency p99: %.1f µs%n", latency.getValueAtPercentile(99) / 1_000.0);
            System.out.printf("Latency p999:%.1f µs%n", latency.getValueAtPercentile(99.9) / 1_000.0);
            System.out.printf("Latency max: %.1f µs%n", latency.getMaxValue() / 1_000.0);
        }
    }

    public Result run() throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicBoolean running = new AtomicBoolean(true);
        List<Histogram> histograms = new ArrayList<>();
        List<Thread> threads = new ArrayList<>();

        for (int w = 0; w < writers; w++) {
            Histogram hist = new Histogram(10_000_000_000L, 3);
            histograms.add(hist);
            long seed = w;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                    writeLoop(new Random(seed), hist);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }, "loadgen-writer-" + w);
            threads.add(t);
        }

        Thread reader = new Thread(() -> {
            while (running.get()) {
                engine.snapshot(10);
                snapshotCount.incrementAndGet();
                Thread.onSpinWait();
            }
        }, "loadgen-reader");
        reader.setDaemon(true);

        threads.forEach(Thread::start);
        reader.start();
        long t0 = System.nanoTime();
        start.countDown();
        done.await();
        long elapsed = System.nanoTime() - t0;
        running.set(false);
        reader.join();

        Histogram total = new Histogram(10_000_000_000L, 3);
        histograms.forEach(total::add);
        log.info("Load finished: {} ops, {} rejects, resting={}", total.getTotalCount(), rejectCount.get(),
                engine.restingOrders());
        return new Result(total.getTotalCount(), rejectCount.get(), snapshotCount.get(), elapsed, total, engine.stats());
    }

    private void writeLoop(Random rnd, Histogram hist) {
        List<Long> resting = new ArrayList<>();
        for (int i = 0; i < ordersPerWriter; i++) {
            int action = rnd.nextInt(20);
            long t0 = System.nanoTime();
            OrderResult r;
            if (action < 3 && !resting.isEmpty()) {
                // swap-remove keeps cancel O(1)
                int idx = rnd.nextInt(resting.size());
                long id = resting.get(idx);
                resting.set(idx, resting.get(resting.size() - 1));
                resting.remove(resting.size() - 1);
                r = engine.cancel(id);
            } else {
                Side side = rnd.nextBoolean() ? Side.BUY : Side.SELL;
                OrderType type = action == 3 ? OrderType.MARKET : action == 4 ? OrderType.IOC : OrderType.LIMIT;
                long offset = (rnd.nextInt(41) - 20) * TICK;
                long price = side == Side.BUY ? MID - TICK + offset : MID + TICK + offset;
                r = engine.submit(OrderRequest.of(engine.nextOrderId(), side, type, price, 1 + rnd.nextInt(100)));
                if (type == OrderType.LIMIT && r.remainingQuantity() > 0 && !r.isRejected()) {
                    resting.add(r.orderId());
                }
            }
            hist.recordValue(Math.min(System.nanoTime() - t0, hist.getHighestTrackableValue()));
            if (r.isRejected()) rejectCount.incrementAndGet();
        }
    }
}
