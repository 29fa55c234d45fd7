package org.clipcrawl.db;

import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A crawl target as tracked across restarts.
 *
 * @param attempts number of times the target has been attempted and failed
 * @param pass     ingestion pass the target was discovered in
 */
public record FrontierTarget(
        String targetKey,
        PageKind kind,
        @Nullable String via,
        State state,
        @Nullable Failure failure,
        @Nullable String error,
        int attempts,
        long pass,
        Instant discoveredAt,
        @Nullable Instant completedAt) {

    public CrawlTarget target() {
        return CrawlTarget.fromKey(targetKey, via);
    }

    public enum State {
        PENDING, COMPLETED, FAILED
    }

    public enum Failure {
        /**
         * Gave up after repeated timeouts or server errors. Retried in later rounds.
         */
        TRANSIENT,
        /**
         * Refused by the portal or known not to exist. Not retried.
         */
        TERMINAL,
        /**
         * Fetched but the page couldn't be parsed. Retried in later rounds.
         */
        PARSE;

        public boolean retryable() {
            return this != TERMINAL;
        }
    }
}
