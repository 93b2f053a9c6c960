package com.orderbook.engine;

import com.orderbook.common.EngineConfig;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Daily boundary (hour:minute in a zone) after which GFD orders expire.
 */
public final class DayResetPolicy {

    private final LocalTime boundary;
    private final ZoneId zone;

    public DayResetPolicy(int hour, int minute, ZoneId zone) {
        EngineConfig.checkResetTime(hour, minute);
        this.boundary = LocalTime.of(hour, minute);
        this.zone = zone;
    }

    public static DayResetPolicy from(EngineConfig cfg) {
        return new DayResetPolicy(cfg.dayResetHour, cfg.dayResetMinute, cfg.zoneId());
    }

    /** Most recent boundary at or before {@code now}. */
    public Instant lastBoundary(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime today = local.toLocalDate().atTime(boundary).atZone(zone);
        return (today.isAfter(local) ? today.minusDays(1) : today).toInstant();
    }

    /** True if a boundary was crossed after {@code lastReset}, up to and including {@code now}. */
    public boolean isDue(Instant lastReset, Instant now) {
        return lastReset.isBefore(lastBoundary(now));
    }

    public LocalTime boundary() { return boundary; }

    public ZoneId zone() { return zone; }

    @Override
    public String toString() {
        return boundary + " " + zone;
    }
}
