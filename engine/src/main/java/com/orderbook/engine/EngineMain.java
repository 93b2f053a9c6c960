package com.orderbook.engine;

import com.orderbook.common.EngineConfig;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for a standalone engine process.
 *
 * Usage:
 *   java -cp ... com.orderbook.engine.EngineMain [config-path]
 *
 * Starts one engine and its maintenance scheduler, then waits for SIGINT/SIGTERM.
 * Order flow comes from in-process collaborators (see the tools module).
 */
public final class EngineMain {

    private static final Logger log = LoggerFactory.getLogger(EngineMain.class);

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : null;
        EngineConfig cfg = EngineConfig.load(configPath);

        log.info("Starting matching engine: orderPoolSize={} dayReset={}:{} {} checkInvariants={}",
                cfg.orderPoolSize, cfg.dayResetHour, cfg.dayResetMinute, cfg.timeZone, cfg.checkInvariants);

        MatchingEngine engine = new MatchingEngine(cfg);
        MaintenanceScheduler scheduler = new MaintenanceScheduler(engine, cfg);
        scheduler.start();

        log.info("Engine running. Waiting for shutdown signal.");
        new ShutdownSignalBarrier().await();

        scheduler.stop();
        log.info("Engine shutdown complete: {}", engine.stats());
    }
}
