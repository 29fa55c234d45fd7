package org.clipcrawl.portal;

import org.clipcrawl.config.PortalConfig;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Owns the single logged-in session shared by every request.
 * <p>
 * Logins are serialized: when several callers find the session expired at once, the first one to get
 * the lock logs in and the others receive the session it produced. A rejected login is remembered so
 * every later caller fails immediately rather than hammering the portal with bad credentials.
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private final PortalConfig config;
    private final CookieManager cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
    private final HttpClient httpClient;
    private final Clock clock;
    private final ReentrantLock loginLock = new ReentrantLock(true);
    private volatile @Nullable PortalSession current;
    private volatile @Nullable AuthenticationException fatal;
    private long generation;

    public SessionManager(PortalConfig config) {
        this(config, Clock.systemUTC());
    }

    public SessionManager(PortalConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .cookieHandler(cookieManager)
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Client carrying the session cookie. All portal requests must go through it.
     */
    public HttpClient httpClient() {
        return httpClient;
    }

    /**
     * Returns the current session, logging in first if there is none or it has grown too old.
     */
    public PortalSession acquire() throws AuthenticationException, InterruptedException {
        checkNotFailed();
        PortalSession session = current;
        if (session != null && !session.olderThan(config.sessionMaxAge(), clock.instant())) {
            return session;
        }
        return renew();
    }

    /**
     * Marks a session as no longer accepted by the portal. Has no effect if a newer session has already
     * replaced it.
     */
    public void invalidate(PortalSession session) {
        loginLock.lock();
        try {
            if (current != null && current.generation() == session.generation()) {
                log.atDebug().addKeyValue("generation", session.generation()).log("Session invalidated");
                current = null;
            }
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Ensures a valid session exists, logging in unless another caller already did so while this one
     * waited for the lock.
     */
    public PortalSession renew() throws AuthenticationException, InterruptedException {
        loginLock.lockInterruptibly();
        try {
            checkNotFailed();
            PortalSession session = current;
            if (session != null && !session.olderThan(config.sessionMaxAge(), clock.instant())) {
                return session;
            }
            current = null;
            try {
                session = login();
            } catch (AuthenticationException e) {
                fatal = e;
                throw e;
            }
            current = session;
            return session;
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Number of successful logins so far.
     */
    public long logins() {
        loginLock.lock();
        try {
            return generation;
        } finally {
            loginLock.unlock();
        }
    }

    private void checkNotFailed() throws AuthenticationException {
        AuthenticationException failure = fatal;
        if (failure != null) throw new AuthenticationException(failure.getMessage(), failure);
    }

    private PortalSession login() throws AuthenticationException, InterruptedException {
        if (config.username() == null || config.password() == null) {
            throw new AuthenticationException("No portal credentials configured");
        }
        cookieManager.getCookieStore().removeAll();
        String form = "identificador=" + PageKind.encode(config.username()) +
                      "&senha=" + PageKind.encode(config.password());
        var request = HttpRequest.newBuilder(config.baseUrl().resolve("/"))
                .timeout(config.requestTimeout())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("User-Agent", config.userAgent())
                .POST(HttpRequest.BodyPublishers.ofString(form, ISO_8859_1))
                .build();

        Exception lastError = null;
        for (int attempt = 1; attempt <= config.loginAttempts(); attempt++) {
            if (attempt > 1) {
                Thread.sleep(config.loginRetryDelay().toMillis());
            }
            log.info("Logging into {} (attempt {}/{})", config.baseUrl(), attempt, config.loginAttempts());
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(ISO_8859_1));
            } catch (IOException e) {
                log.warn("Login request failed: {}", e.toString());
                lastError = e;
                continue;
            }
            if (response.statusCode() >= 500 || response.statusCode() == 429) {
                log.warn("Login request failed with status {}", response.statusCode());
                lastError = new IOException("HTTP " + response.statusCode());
                continue;
            }
            if (response.statusCode() >= 400 || isLoginRejected(response.body())) {
                throw new AuthenticationException("Portal rejected the login for " + config.username());
            }
            generation++;
            var session = new PortalSession(generation, clock.instant());
            log.atInfo().addKeyValue("generation", generation).log("Logged into portal");
            return session;
        }
        throw new AuthenticationException("Unable to reach the portal to log in after " +
                                          config.loginAttempts() + " attempts", lastError);
    }

    /**
     * Whether a page is the login form, which the portal serves in place of any page once the session
     * has lapsed. Only the form's credential field counts: ordinary pages may well mention passwords.
     */
    static boolean isLoginForm(String html) {
        String lower = html.toLowerCase(Locale.ROOT);
        if (!lower.contains("<form")) return false;
        return lower.contains("name=\"senha\"") || lower.contains("name='senha'") || lower.contains("name=senha");
    }

    /**
     * Whether the response to a login POST means the credentials were refused. The portal answers with
     * the login form again, or with an error mentioning the password.
     */
    static boolean isLoginRejected(String html) {
        return isLoginForm(html) || html.toLowerCase(Locale.ROOT).contains("password");
    }
}
