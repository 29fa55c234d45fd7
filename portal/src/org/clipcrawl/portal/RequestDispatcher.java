package org.clipcrawl.portal;

import org.clipcrawl.config.FetchConfig;
import org.clipcrawl.config.PortalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Locale;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Fetches pages from the portal through the shared session and rate limiter, retrying what is worth
 * retrying.
 * <ul>
 *     <li>An expired session is renewed and the request repeated without using up an attempt. If the
 *     portal still answers with the login form on the session that renewal produced, the target fails
 *     as terminal instead of logging in again.</li>
 *     <li>Timeouts, connection errors, 5xx and 429 responses and truncated pages are retried with
 *     exponential backoff until {@link FetchConfig#maxAttempts()} attempts have been made.</li>
 *     <li>Any other 4xx response, and the portal's "invalid request" page, fail immediately.</li>
 * </ul>
 * Safe for concurrent use by any number of workers.
 */
public class RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);
    static final String INVALID_REQUEST_MARKER = "Pedido inválido";

    private final PortalConfig portalConfig;
    private final FetchConfig fetchConfig;
    private final SessionManager sessionManager;
    private final RateLimiter rateLimiter;
    private final Backoff backoff;

    public RequestDispatcher(PortalConfig portalConfig, FetchConfig fetchConfig, SessionManager sessionManager,
                             RateLimiter rateLimiter) {
        this.portalConfig = portalConfig;
        this.fetchConfig = fetchConfig;
        this.sessionManager = sessionManager;
        this.rateLimiter = rateLimiter;
        this.backoff = new Backoff(fetchConfig.initialBackoff(), fetchConfig.maxBackoff());
    }

    public RawPage fetch(CrawlTarget target) throws FetchException, AuthenticationException, InterruptedException {
        int attempts = 0;
        int renewals = 0;
        long renewedGeneration = -1;
        while (true) {
            rateLimiter.await();
            PortalSession session = sessionManager.acquire();

            HttpResponse<byte[]> response;
            try {
                response = sessionManager.httpClient().send(buildRequest(target), HttpResponse.BodyHandlers.ofByteArray());
            } catch (IOException e) {
                attempts++;
                log.atWarn().addKeyValue("target", target.key()).addKeyValue("attempt", attempts)
                        .log("Request failed: {}", e.toString());
                if (attempts >= fetchConfig.maxAttempts()) {
                    throw new FetchException(FetchException.Kind.TRANSIENT, attempts, -1,
                            "Giving up after " + attempts + " attempts: " + e, e);
                }
                backoff.sleep(attempts);
                continue;
            }

            Outcome outcome = redirectedToLogin(response) ? Outcome.AUTH_EXPIRED :
                    classify(target.kind(), response.statusCode(), response.body(),
                            response.headers().firstValue("Content-Type").orElse(null));
            switch (outcome) {
                case SUCCESS -> {
                    return new RawPage(target, response.body(), Instant.now(), response.statusCode(),
                            response.headers().firstValue("Content-Type").orElse(null));
                }
                case AUTH_EXPIRED -> {
                    if (session.generation() == renewedGeneration) {
                        attempts++;
                        log.atWarn().addKeyValue("target", target.key()).addKeyValue("generation", session.generation())
                                .log("Login form served again right after renewing the session");
                        throw new FetchException(FetchException.Kind.TERMINAL, attempts, response.statusCode(),
                                "Portal rejected a freshly renewed session");
                    }
                    renewals++;
                    log.atInfo().addKeyValue("target", target.key()).addKeyValue("renewals", renewals)
                            .log("Session expired, renewing");
                    sessionManager.invalidate(session);
                    renewedGeneration = sessionManager.renew().generation();
                }
                case TRANSIENT -> {
                    attempts++;
                    log.atWarn().addKeyValue("target", target.key()).addKeyValue("attempt", attempts)
                            .addKeyValue("status", response.statusCode()).log("Transient failure");
                    if (attempts >= fetchConfig.maxAttempts()) {
                        throw new FetchException(FetchException.Kind.TRANSIENT, attempts, response.statusCode(),
                                "Giving up after " + attempts + " attempts, last status " + response.statusCode());
                    }
                    backoff.sleep(attempts);
                }
                case TERMINAL -> {
                    attempts++;
                    throw new FetchException(FetchException.Kind.TERMINAL, attempts, response.statusCode(),
                            describeTerminal(response.statusCode()));
                }
            }
        }
    }

    private HttpRequest buildRequest(CrawlTarget target) {
        var builder = HttpRequest.newBuilder(target.uri(portalConfig.baseUrl()))
                .timeout(portalConfig.requestTimeout())
                .header("User-Agent", portalConfig.userAgent());
        if (target.kind().method() == PageKind.Method.POST) {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(target.formData(), ISO_8859_1));
        } else {
            builder.GET();
        }
        return builder.build();
    }

    /**
     * The portal sends lapsed sessions back to its front page, which is where the login form lives.
     */
    static boolean redirectedToLogin(HttpResponse<?> response) {
        if (response.previousResponse().isEmpty()) return false;
        String path = response.uri().getPath();
        return path == null || path.isEmpty() || path.equals("/");
    }

    private static String describeTerminal(int status) {
        if (status >= 200 && status < 300) return "Portal reported an invalid request";
        return "HTTP " + status;
    }

    static Outcome classify(PageKind kind, int status, byte[] body, String contentType) {
        if (status == 401 || status == 403) return Outcome.AUTH_EXPIRED;
        if (status == 429 || status >= 500) return Outcome.TRANSIENT;
        if (status >= 400) return Outcome.TERMINAL;
        if (status < 200 || status >= 300) return Outcome.TRANSIENT;
        if (body.length == 0) return Outcome.TRANSIENT;

        boolean html = kind.shape() == PageKind.Shape.HTML ||
                       (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/html"));
        if (!html) return Outcome.SUCCESS;

        String text = new String(body, ISO_8859_1);
        if (SessionManager.isLoginForm(text)) return Outcome.AUTH_EXPIRED;
        if (text.contains(INVALID_REQUEST_MARKER) ||
            new String(body, UTF_8).contains(INVALID_REQUEST_MARKER)) {
            return Outcome.TERMINAL;
        }
        if (kind.shape() == PageKind.Shape.HTML && !text.toLowerCase(Locale.ROOT).contains("</html>")) {
            return Outcome.TRANSIENT;
        }
        return Outcome.SUCCESS;
    }

    enum Outcome {
        SUCCESS, AUTH_EXPIRED, TRANSIENT, TERMINAL
    }
}
