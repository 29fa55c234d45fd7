package org.clipcrawl.portal;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void burstIsAllowedImmediately() throws InterruptedException {
        var limiter = new RateLimiter(10, 3);
        assertTrue(limiter.reserve() <= 0);
        assertTrue(limiter.reserve() <= 0);
        assertTrue(limiter.reserve() <= 0);
        assertTrue(limiter.reserve() > 0, "fourth request should have to wait");
    }

    @Test
    void sustainedRateStaysWithinCeiling() throws Exception {
        double rate = 50;
        int burst = 5;
        var limiter = new RateLimiter(rate, burst);
        List<Long> grants = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        long start = System.nanoTime();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 12; i++) {
                        limiter.await();
                        grants.add(System.nanoTime());
                    }
                    return null;
                }));
            }
            for (var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        long elapsed = System.nanoTime() - start;

        List<Long> sorted = new ArrayList<>(grants);
        Collections.sort(sorted);
        assertEquals(96, sorted.size());
        long window = TimeUnit.SECONDS.toNanos(1);
        int maxInWindow = 0;
        int j = 0;
        for (int i = 0; i < sorted.size(); i++) {
            while (sorted.get(i) - sorted.get(j) >= window) j++;
            maxInWindow = Math.max(maxInWindow, i - j + 1);
        }
        // one extra for scheduling jitter at the window edges
        assertTrue(maxInWindow <= rate + burst + 1, "saw " + maxInWindow + " requests in one second");
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(1700), "finished too quickly: " + elapsed + "ns");
    }
}
