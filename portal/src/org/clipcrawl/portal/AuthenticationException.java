package org.clipcrawl.portal;

/**
 * Logging in failed permanently: the credentials were rejected or the portal could not be reached
 * after the configured number of login attempts.
 */
public class AuthenticationException extends Exception {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
