package org.clipcrawl.portal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every request to the portal.
 * <p>
 * Callers reserve a slot in arrival order under a fair lock and then sleep outside it until the slot
 * comes due, so a waiter can never be overtaken by later arrivals. Up to {@code burst} requests may
 * proceed back to back after an idle period; beyond that requests are spaced at the sustained rate.
 */
public class RateLimiter {
    private final ReentrantLock lock = new ReentrantLock(true);
    private final long intervalNanos;
    private final long burstNanos;
    private long nextSlot;

    public RateLimiter(double requestsPerSecond, int burst) {
        if (requestsPerSecond <= 0) throw new IllegalArgumentException("requestsPerSecond must be positive");
        if (burst < 1) throw new IllegalArgumentException("burst must be at least 1");
        this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
        this.burstNanos = intervalNanos * (burst - 1);
        this.nextSlot = System.nanoTime() - burstNanos;
    }

    /**
     * Blocks until the caller may send a request.
     */
    public void await() throws InterruptedException {
        long delay = reserve();
        if (delay > 0) {
            TimeUnit.NANOSECONDS.sleep(delay);
        }
    }

    /**
     * Claims the next slot and returns how long the caller must wait for it, in nanoseconds.
     */
    long reserve() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long now = System.nanoTime();
            long slot = Math.max(nextSlot, now - burstNanos);
            nextSlot = slot + intervalNanos;
            return slot - now;
        } finally {
            lock.unlock();
        }
    }
}
