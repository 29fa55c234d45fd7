package org.clipcrawl.portal;

public class FetchException extends Exception {
    private final Kind kind;
    private final int attempts;
    private final int status;

    public FetchException(Kind kind, int attempts, int status, String message) {
        this(kind, attempts, status, message, null);
    }

    public FetchException(Kind kind, int attempts, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.attempts = attempts;
        this.status = status;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Number of attempts made, not counting ones repeated after a session renewal.
     */
    public int attempts() {
        return attempts;
    }

    /**
     * HTTP status of the last response, or -1 if none was received.
     */
    public int status() {
        return status;
    }

    public enum Kind {
        /**
         * Retries were exhausted on timeouts, server errors or truncated responses.
         */
        TRANSIENT,
        /**
         * Not worth retrying, the page doesn't exist or the request was refused.
         */
        TERMINAL
    }
}
