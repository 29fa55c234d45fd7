package org.clipcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.clipcrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * Request pacing and retry behaviour.
 *
 * @param requestsPerSecond sustained request rate across all workers
 * @param burst             requests allowed back to back after an idle period
 * @param maxAttempts       attempts per page before a transient failure is reported
 * @param initialBackoff    delay before the first retry, doubled on each further retry
 * @param maxBackoff        upper bound on the retry delay
 * @param workers           pages fetched concurrently
 */
public record FetchConfig(
        double requestsPerSecond,
        int burst,
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration initialBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxBackoff,
        int workers) {

    public FetchConfig {
        if (requestsPerSecond <= 0) requestsPerSecond = 1;
        if (burst < 1) burst = 1;
        if (maxAttempts < 1) maxAttempts = 1;
        if (initialBackoff == null) initialBackoff = Duration.ofSeconds(1);
        if (maxBackoff == null) maxBackoff = Duration.ofMinutes(1);
        if (workers < 1) workers = 1;
    }
}
