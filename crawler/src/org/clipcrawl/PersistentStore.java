package org.clipcrawl;

import org.clipcrawl.db.CommitBatch;
import org.clipcrawl.db.CommitResult;
import org.clipcrawl.db.CrawlCheckpoint;
import org.clipcrawl.db.EntityReference;
import org.clipcrawl.db.StoreCommitException;
import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.ReconciledEntity;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The store ingestion writes to and query layers read from. Commits are applied one at a time, each
 * atomically together with the checkpoint advance it protects.
 */
public interface PersistentStore {
    Optional<ReconciledEntity> findById(UUID id);

    Optional<ReconciledEntity> findByNaturalKey(EntityKind kind, String naturalKey);

    /**
     * Entities whose name contains the given text, ignoring ASCII case.
     *
     * @param kind restricts the search to one kind if not null
     */
    List<ReconciledEntity> search(String text, @Nullable EntityKind kind, int limit);

    List<EntityReference> references(UUID entityId);

    CommitResult commit(CommitBatch batch) throws StoreCommitException;

    CrawlCheckpoint checkpoint();
}
