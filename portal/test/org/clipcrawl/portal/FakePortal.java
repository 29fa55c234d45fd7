package org.clipcrawl.portal;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal stand-in for the portal: a login form at the root that hands out a session cookie, and a
 * page handler that only answers requests carrying the current cookie.
 */
class FakePortal implements AutoCloseable {
    static final String LOGIN_FORM = "<html><body><form method=\"post\" action=\"/\">" +
                                     "<input name=\"identificador\"><input type=\"password\" name=\"senha\">" +
                                     "</form></body></html>";

    interface PageHandler {
        void handle(HttpExchange exchange) throws IOException;
    }

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    final AtomicInteger logins = new AtomicInteger();
    final AtomicInteger pageRequests = new AtomicInteger();
    volatile String lastLoginBody;
    volatile String validSession;
    volatile boolean rejectLogins;
    volatile int loginDelayMillis;
    volatile PageHandler pages = exchange -> respond(exchange, 200, "<html><body>ok</body></html>");

    FakePortal() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    URI baseUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    void expireSessions() {
        validSession = null;
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (exchange.getRequestMethod().equals("POST") && exchange.getRequestURI().getPath().equals("/")) {
                lastLoginBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1);
                if (loginDelayMillis > 0) {
                    try {
                        Thread.sleep(loginDelayMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                int n = logins.incrementAndGet();
                if (rejectLogins) {
                    respond(exchange, 200, LOGIN_FORM);
                    return;
                }
                String sid = "s" + n;
                validSession = sid;
                exchange.getResponseHeaders().add("Set-Cookie", "sid=" + sid + "; Path=/");
                respond(exchange, 200, "<html><body>Bem-vindo</body></html>");
                return;
            }
            pageRequests.incrementAndGet();
            if (!hasValidSession(exchange)) {
                respond(exchange, 200, LOGIN_FORM);
                return;
            }
            pages.handle(exchange);
        } finally {
            exchange.close();
        }
    }

    private boolean hasValidSession(HttpExchange exchange) {
        String sid = validSession;
        if (sid == null) return false;
        List<String> cookies = exchange.getRequestHeaders().get("Cookie");
        if (cookies == null) return false;
        for (String header : cookies) {
            for (String cookie : header.split(";")) {
                if (cookie.trim().equals("sid=" + sid)) return true;
            }
        }
        return false;
    }

    static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.ISO_8859_1);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=ISO-8859-1");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) exchange.getResponseBody().write(bytes);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
