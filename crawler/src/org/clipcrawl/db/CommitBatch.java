package org.clipcrawl.db;

import org.clipcrawl.model.MergeConflict;
import org.clipcrawl.model.ReconciledEntity;
import org.clipcrawl.portal.CrawlTarget;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Everything produced by a group of finished targets, written in one transaction together with the
 * checkpoint advance.
 *
 * @param pass           the pass committing
 * @param entities       merged entities to upsert
 * @param conflicts      merge conflicts to record
 * @param blobReferences attachment references to add
 * @param discovered     targets to add to the frontier as pending
 * @param outcomes       final state of each target in the batch
 */
public record CommitBatch(
        long pass,
        List<ReconciledEntity> entities,
        List<MergeConflict> conflicts,
        List<BlobReference> blobReferences,
        List<CrawlTarget> discovered,
        List<TargetOutcome> outcomes) {

    public CommitBatch {
        entities = List.copyOf(entities);
        conflicts = List.copyOf(conflicts);
        blobReferences = List.copyOf(blobReferences);
        discovered = List.copyOf(discovered);
        outcomes = List.copyOf(outcomes);
    }

    public boolean isEmpty() {
        return entities.isEmpty() && outcomes.isEmpty() && discovered.isEmpty();
    }

    public @Nullable String lastTarget() {
        return outcomes.isEmpty() ? null : outcomes.get(outcomes.size() - 1).targetKey();
    }

    /**
     * @param hash     content hash
     * @param referrer id of the referring entity
     * @param replaces hash the referrer pointed at before, released if different
     */
    public record BlobReference(String hash, String referrer, @Nullable String replaces) {
    }

    public record TargetOutcome(String targetKey, FrontierTarget.State state,
                                @Nullable FrontierTarget.Failure failure, @Nullable String error) {
        public static TargetOutcome completed(CrawlTarget target) {
            return new TargetOutcome(target.key(), FrontierTarget.State.COMPLETED, null, null);
        }

        public static TargetOutcome failed(CrawlTarget target, FrontierTarget.Failure failure, String error) {
            return new TargetOutcome(target.key(), FrontierTarget.State.FAILED, failure, error);
        }
    }
}
