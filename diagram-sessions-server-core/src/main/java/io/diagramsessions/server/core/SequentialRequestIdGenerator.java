package io.diagramsessions.server.core;

import io.diagramsessions.server.spi.RequestIdGenerator;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates request ids from one engine-wide counter, encoded as fixed-width base-36 so ids sort
 * in issue order.
 */
public final class SequentialRequestIdGenerator implements RequestIdGenerator {

    private static final int WIDTH = 13;

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialRequestIdGenerator() {
        this("server-");
    }

    public SequentialRequestIdGenerator(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public String next(String clientId) {
        return prefix + encode(counter.incrementAndGet());
    }

    static String encode(long value) {
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        String s = Long.toString(value, 36);
        return "0".repeat(WIDTH - s.length()) + s;
    }
}
