package com.fincraft.etl.fetch;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum spacing between upstream requests, shared by every worker of the process.
 */
public final class RequestThrottle {
    private final long spacingNanos;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    public RequestThrottle(long spacingMs) {
        this.spacingNanos = Math.max(0L, spacingMs) * 1_000_000L;
    }

    public static RequestThrottle perMinute(int requestsPerMinute) {
        if (requestsPerMinute <= 0) {
            return new RequestThrottle(0L);
        }
        return new RequestThrottle((long) Math.ceil(60_000.0 / requestsPerMinute));
    }

    public long spacingMs() {
        return spacingNanos / 1_000_000L;
    }

    public void acquire() throws InterruptedException {
        if (spacingNanos <= 0L) {
            return;
        }
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + spacingNanos;
            if (prev != 0L && now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }
}
