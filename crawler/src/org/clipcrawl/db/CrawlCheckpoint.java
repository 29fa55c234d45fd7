package org.clipcrawl.db;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Durable marker of ingestion progress. Advanced in the same transaction as every committed batch;
 * the targets still to do are the frontier's pending rows.
 *
 * @param pass        number of the current or last ingestion pass
 * @param commitSeq   batches committed in this pass
 * @param committedAt time of the last commit
 * @param lastTarget  last target whose results were committed
 * @param state       coordinator state when the checkpoint was last written
 */
public record CrawlCheckpoint(
        long pass,
        long commitSeq,
        @Nullable Instant committedAt,
        @Nullable String lastTarget,
        String state) {
}
