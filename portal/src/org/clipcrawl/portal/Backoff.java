package org.clipcrawl.portal;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: the n-th retry waits a random time between half and all of
 * {@code min(max, initial * 2^(n-1))}.
 */
record Backoff(Duration initial, Duration max) {
    Duration delay(int retry) {
        long initialMillis = Math.max(1, initial.toMillis());
        long ceiling = max.toMillis();
        int shift = Math.min(Math.max(retry - 1, 0), 30);
        long delay = initialMillis > (ceiling >> shift) ? ceiling : initialMillis << shift;
        delay = Math.min(delay, ceiling);
        long half = delay / 2;
        return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(delay - half + 1));
    }

    void sleep(int retry) throws InterruptedException {
        Thread.sleep(delay(retry).toMillis());
    }
}
