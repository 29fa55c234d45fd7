package org.clipcrawl.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.clipcrawl.util.DurationDeserializer;

import java.net.URI;
import java.time.Duration;

/**
 * How to reach and log into the portal.
 *
 * @param baseUrl         scheme, host and port of the portal, login form is posted to its root
 * @param username        login identifier
 * @param password        login password
 * @param userAgent       User-Agent header sent with every request
 * @param loginAttempts   attempts at reaching the login form before giving up on the pass
 * @param loginRetryDelay pause between login attempts
 * @param requestTimeout  timeout for a single request
 * @param sessionMaxAge   sessions older than this are renewed before use
 */
public record PortalConfig(
        URI baseUrl,
        String username,
        @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
        String password,
        String userAgent,
        int loginAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration loginRetryDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration requestTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration sessionMaxAge) {

    public PortalConfig {
        if (baseUrl == null) throw new IllegalArgumentException("portal.baseUrl is required");
        if (loginAttempts < 1) loginAttempts = 1;
        if (loginRetryDelay == null) loginRetryDelay = Duration.ofSeconds(5);
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(30);
        if (sessionMaxAge == null) sessionMaxAge = Duration.ofMinutes(15);
    }

    @Override
    public String toString() {
        return "PortalConfig[baseUrl=" + baseUrl + ", username=" + username + ", userAgent=" + userAgent + "]";
    }
}
