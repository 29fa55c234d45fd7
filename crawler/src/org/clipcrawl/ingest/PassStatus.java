package org.clipcrawl.ingest;

import org.clipcrawl.db.CrawlCheckpoint;
import org.clipcrawl.db.FrontierTarget;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Snapshot of a pass for operators.
 *
 * @param pass                 pass number
 * @param state                coordinator state
 * @param remaining            targets queued and not yet started
 * @param inFlight             targets being fetched or parsed
 * @param completed            targets committed as completed
 * @param failures             targets whose last attempt failed, retryable or not
 * @param checkpoint           last committed checkpoint
 * @param unresolvedReferences references whose target entity hasn't been observed yet
 * @param error                why the pass failed, if it did
 */
public record PassStatus(
        long pass,
        IngestCoordinator.State state,
        long remaining,
        int inFlight,
        long completed,
        List<FrontierTarget> failures,
        CrawlCheckpoint checkpoint,
        long unresolvedReferences,
        @Nullable String error) {
}
