package org.clipcrawl.db;

public class StoreCommitException extends Exception {
    public StoreCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
