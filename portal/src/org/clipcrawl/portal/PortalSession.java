package org.clipcrawl.portal;

import java.time.Duration;
import java.time.Instant;

/**
 * One successful login. The cookie itself lives in the session manager's cookie store, this is the
 * handle callers pass back when they find it has expired.
 *
 * @param generation    counts logins, starting at 1
 * @param authenticatedAt when the login completed
 */
public record PortalSession(long generation, Instant authenticatedAt) {
    boolean olderThan(Duration maxAge, Instant now) {
        return authenticatedAt.plus(maxAge).isBefore(now);
    }
}
