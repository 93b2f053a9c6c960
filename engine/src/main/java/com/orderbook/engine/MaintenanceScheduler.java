package com.orderbook.engine;

import com.orderbook.common.EngineConfig;
import com.orderbook.protocol.BookSnapshot;
import com.orderbook.protocol.EngineStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the engine's periodic work on one daemon thread:
 *   - maintenance tick (day reset when the boundary has passed)
 *   - statistics summary log
 *
 * Both go through the engine's public operations and take the same locks as any
 * other caller.
 */
public final class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final MatchingEngine engine;
    private final EngineConfig cfg;
    private final ScheduledExecutorService scheduler;

    public MaintenanceScheduler(MatchingEngine engine, EngineConfig cfg) {
        this.engine = engine;
        this.cfg = cfg;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "engine-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::maintenanceTick,
                cfg.maintenanceIntervalSecs, cfg.maintenanceIntervalSecs, TimeUnit.SECONDS);
        scheduler.scheduleAtFixedRate(this::logSummary,
                cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
        log.info("Maintenance scheduler started: tick={}s stats={}s dayReset={}",
                cfg.maintenanceIntervalSecs, cfg.metricsIntervalSecs, engine.dayResetPolicy());
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void maintenanceTick() {
        try {
            int purged = engine.runMaintenance();
            if (purged >= 0) log.info("Scheduled day reset purged {} GFD orders", purged);
        } catch (RuntimeException e) {
            // keep the schedule alive; invariant violations were already logged by the engine
            log.error("Maintenance tick failed", e);
        }
    }

    void logSummary() {
        try {
            EngineStatistics s = engine.stats();
            BookSnapshot top = engine.snapshot(1);
            log.info("Engine summary: submitted={} rejected={} cancels={} modifies={} trades={} volume={} "
                            + "avgLatency={}µs p99={}µs bestBid={} bestAsk={} resting={}",
                    s.ordersSubmitted(), s.ordersRejected(), s.cancellations(), s.modifications(),
                    s.tradesExecuted(), s.volumeTraded(),
                    String.format("%.1f", s.averageLatencyMicros()),
                    String.format("%.1f", s.p99LatencyNanos() / 1_000.0),
                    top.bestBid().isPresent() ? top.bestBid().getAsLong() : "-",
                    top.bestAsk().isPresent() ? top.bestAsk().getAsLong() : "-",
                    engine.restingOrders());
        } catch (RuntimeException e) {
            log.error("Error in periodic stats logging", e);
        }
    }
}
