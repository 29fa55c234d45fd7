package org.clipcrawl.portal;

import org.clipcrawl.config.PortalConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {
    private FakePortal portal;

    @BeforeEach
    void setUp() throws Exception {
        portal = new FakePortal();
    }

    @AfterEach
    void tearDown() {
        portal.close();
    }

    private PortalConfig config() {
        return new PortalConfig(portal.baseUri(), "jsmith", "s3cret", "clipcrawl-test", 2,
                Duration.ofMillis(10), Duration.ofSeconds(5), Duration.ofMinutes(15));
    }

    @Test
    void acquireLogsInOnceAndReusesSession() throws Exception {
        var sessions = new SessionManager(config());
        var first = sessions.acquire();
        var second = sessions.acquire();
        assertEquals(first, second);
        assertEquals(1, portal.logins.get());
        assertEquals("identificador=jsmith&senha=s3cret", portal.lastLoginBody);
    }

    @Test
    void concurrentRenewalsLogInExactlyOnce() throws Exception {
        var sessions = new SessionManager(config());
        var stale = sessions.acquire();
        portal.loginDelayMillis = 200;

        int callers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        var ready = new CountDownLatch(callers);
        var go = new CountDownLatch(1);
        try {
            List<Future<PortalSession>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    sessions.invalidate(stale);
                    return sessions.renew();
                }));
            }
            ready.await();
            go.countDown();
            for (var future : futures) {
                var renewed = future.get(10, TimeUnit.SECONDS);
                assertEquals(2, renewed.generation());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(2, portal.logins.get());
        assertEquals(2, sessions.logins());
    }

    @Test
    void rejectedCredentialsAreFatalAndRemembered() {
        portal.rejectLogins = true;
        var sessions = new SessionManager(config());
        assertThrows(AuthenticationException.class, sessions::acquire);
        assertThrows(AuthenticationException.class, sessions::acquire);
        assertThrows(AuthenticationException.class, sessions::renew);
        assertEquals(1, portal.logins.get(), "a rejected login must not be retried");
    }

    @Test
    void unreachablePortalFailsAfterConfiguredAttempts() {
        var base = portal.baseUri();
        portal.close();
        var config = new PortalConfig(base, "jsmith", "s3cret", "clipcrawl-test", 3,
                Duration.ofMillis(1), Duration.ofSeconds(2), Duration.ofMinutes(15));
        var sessions = new SessionManager(config);
        var e = assertThrows(AuthenticationException.class, sessions::acquire);
        assertTrue(e.getMessage().contains("3 attempts"), e.getMessage());
    }

    @Test
    void missingCredentialsFailBeforeAnyRequest() {
        var config = new PortalConfig(portal.baseUri(), null, null, "clipcrawl-test", 1,
                null, null, null);
        assertThrows(AuthenticationException.class, () -> new SessionManager(config).acquire());
        assertEquals(0, portal.logins.get());
    }

    @Test
    void oldSessionsAreRenewedBeforeUse() throws Exception {
        var clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        var sessions = new SessionManager(config(), clock);
        assertEquals(1, sessions.acquire().generation());
        clock.advance(Duration.ofMinutes(10));
        assertEquals(1, sessions.acquire().generation());
        clock.advance(Duration.ofMinutes(6));
        assertEquals(2, sessions.acquire().generation());
        assertEquals(2, portal.logins.get());
    }

    static class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void onlyTheCredentialFormCountsAsLoginPage() {
        assertTrue(SessionManager.isLoginForm(FakePortal.LOGIN_FORM));
        assertFalse(SessionManager.isLoginForm("<html><body><a>Aula 3 - password hashing.pdf</a></body></html>"));
        assertFalse(SessionManager.isLoginForm("<html><body><form action=\"/pesquisa\"><input name=\"q\"></form></body></html>"));
        assertTrue(SessionManager.isLoginRejected("<html><body>Invalid password</body></html>"));
        assertFalse(SessionManager.isLoginRejected("<html><body>Bem-vindo</body></html>"));
    }
}
