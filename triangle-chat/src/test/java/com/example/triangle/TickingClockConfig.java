package com.example.triangle;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Clock that advances one millisecond on every read, so timestamps taken by the store are distinct and ordered.
 */
@TestConfiguration
public class TickingClockConfig {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Bean
    @Primary
    public Clock tickingClock() {
        return new TickingClock(START);
    }

    static class TickingClock extends Clock {

        private final AtomicLong millis;

        TickingClock(Instant start) {
            this.millis = new AtomicLong(start.toEpochMilli());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis.incrementAndGet());
        }
    }
}
