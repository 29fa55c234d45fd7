package org.clipcrawl.ingest;

import org.clipcrawl.PersistentStore;
import org.clipcrawl.db.CommitBatch;
import org.clipcrawl.db.CommitResult;
import org.clipcrawl.db.StoreCommitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single writer of a pass. A failed commit is retried once with the whole batch; a second failure
 * is surfaced to the caller and ends the pass.
 */
class BatchCommitter {
    private static final Logger log = LoggerFactory.getLogger(BatchCommitter.class);
    private final PersistentStore store;
    private long commits;

    BatchCommitter(PersistentStore store) {
        this.store = store;
    }

    synchronized CommitResult commit(CommitBatch batch) throws StoreCommitException {
        CommitResult result;
        try {
            result = store.commit(batch);
        } catch (StoreCommitException e) {
            log.atWarn().addKeyValue("pass", batch.pass()).addKeyValue("targets", batch.outcomes().size())
                    .setCause(e).log("Commit failed, retrying once");
            result = store.commit(batch);
        }
        commits++;
        log.atDebug().addKeyValue("pass", batch.pass())
                .addKeyValue("entities", batch.entities().size())
                .addKeyValue("targets", batch.outcomes().size())
                .addKeyValue("commitSeq", result.checkpoint().commitSeq())
                .log("Committed batch");
        return result;
    }

    synchronized long commits() {
        return commits;
    }
}
