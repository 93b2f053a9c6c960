package com.orderbook.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Central configuration loaded from orderbook.yml (or classpath default).
 * All fields have sensible defaults for a single local engine.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    // Book
    public int orderPoolSize = 100_000;      // max resting + in-flight orders
    public boolean checkInvariants = false;  // full structural check after every mutation

    // Day reset
    public int dayResetHour = 15;
    public int dayResetMinute = 59;
    public String timeZone = "UTC";
    public int maintenanceIntervalSecs = 30;

    // Reporting
    public int metricsIntervalSecs = 5;
    public int snapshotDepth = 10;

    public static EngineConfig load(String path) {
        EngineConfig cfg = new EngineConfig();
        try (InputStream is = open(path)) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
            cfg.validate();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load config from {}, using defaults: {}", path != null ? path : "classpath", e.getMessage());
            return new EngineConfig();
        }
        return cfg;
    }

    private static InputStream open(String path) throws IOException {
        if (path != null) {
            Path p = Paths.get(path);
            if (Files.exists(p)) return Files.newInputStream(p);
        }
        return EngineConfig.class.getResourceAsStream("/orderbook.yml");
    }

    private static void applyMap(EngineConfig cfg, Map<String, Object> map) {
        if (map.containsKey("orderPoolSize")) cfg.orderPoolSize = (int) map.get("orderPoolSize");
        if (map.containsKey("checkInvariants")) cfg.checkInvariants = (boolean) map.get("checkInvariants");
        if (map.containsKey("dayResetHour")) cfg.dayResetHour = (int) map.get("dayResetHour");
        if (map.containsKey("dayResetMinute")) cfg.dayResetMinute = (int) map.get("dayResetMinute");
        if (map.containsKey("timeZone")) cfg.timeZone = (String) map.get("timeZone");
        if (map.containsKey("maintenanceIntervalSecs")) cfg.maintenanceIntervalSecs = (int) map.get("maintenanceIntervalSecs");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
        if (map.containsKey("snapshotDepth")) cfg.snapshotDepth = (int) map.get("snapshotDepth");
    }

    /** @throws IllegalArgumentException if any field is out of range */
    public void validate() {
        if (orderPoolSize <= 0) throw new IllegalArgumentException("orderPoolSize must be positive: " + orderPoolSize);
        checkResetTime(dayResetHour, dayResetMinute);
        if (maintenanceIntervalSecs <= 0) {
            throw new IllegalArgumentException("maintenanceIntervalSecs must be positive: " + maintenanceIntervalSecs);
        }
        if (metricsIntervalSecs <= 0) {
            throw new IllegalArgumentException("metricsIntervalSecs must be positive: " + metricsIntervalSecs);
        }
        if (snapshotDepth <= 0) throw new IllegalArgumentException("snapshotDepth must be positive: " + snapshotDepth);
        zoneId();
    }

    public ZoneId zoneId() {
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timeZone: " + timeZone, e);
        }
    }

    public static void checkResetTime(int hour, int minute) {
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("dayResetHour must be 0-23: " + hour);
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("dayResetMinute must be 0-59: " + minute);
    }
}
