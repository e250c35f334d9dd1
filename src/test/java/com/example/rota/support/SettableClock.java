package com.example.rota.support;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock the tests move by hand.
 */
public class SettableClock extends Clock {

    private volatile Instant instant;
    private final ZoneId zone;

    public SettableClock(LocalDateTime start) {
        this(start.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private SettableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    public void set(LocalDateTime time) {
        this.instant = time.atZone(zone).toInstant();
    }

    public void advanceMinutes(long minutes) {
        this.instant = instant.plusSeconds(minutes * 60);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new SettableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
