package org.clipcrawl.identity;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.clipcrawl.Database;
import org.clipcrawl.model.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps natural keys to surrogate identities and folds partial observations into one entity.
 * <p>
 * Identities are allocated by an insert-if-absent against the identities table, so each natural key
 * gets exactly one identifier however many workers race on it. Merged entities are held in memory
 * until committed; merges on the same entity are serialized.
 * <p>
 * Merge rules, per field of the incoming record:
 * <ul>
 *     <li>absent fields leave the entity untouched</li>
 *     <li>a field with no value yet takes the incoming value</li>
 *     <li>{@code first_year}/{@code last_year} widen to cover both observations</li>
 *     <li>a different value replaces the stored one only if the incoming page is authoritative for the
 *     field, and, when the stored value came from an authoritative page too, the incoming page was
 *     fetched no earlier. Every replaced or rejected value is kept as a {@link MergeConflict}.</li>
 * </ul>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);
    private final Database db;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();
    private final Map<NaturalKey, SurrogateIdentity> identities = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, Working> working = new ConcurrentHashMap<>();

    public IdentityResolver(Database db) {
        this.db = db;
    }

    public SurrogateIdentity resolve(StructuredRecord record) {
        return resolve(record.key());
    }

    public SurrogateIdentity resolve(NaturalKey key) {
        SurrogateIdentity identity = identities.get(key);
        if (identity != null) return identity;
        return identities.computeIfAbsent(key, this::allocate);
    }

    private SurrogateIdentity allocate(NaturalKey key) {
        return db.inTransaction(tx -> {
            int inserted = tx.identities().insertIfAbsent(uuidGenerator.generate(), key.kind(), key.value(), Instant.now());
            SurrogateIdentity identity = tx.identities().find(key.kind(), key.value());
            if (inserted > 0) {
                log.atDebug().addKeyValue("key", key).addKeyValue("id", identity.id()).log("Allocated identity");
            }
            return identity;
        });
    }

    /**
     * Merges a record into the entity, starting from the stored entity if it isn't already held in
     * memory.
     */
    public ReconciledEntity merge(SurrogateIdentity identity, StructuredRecord record) {
        if (!identity.key().equals(record.key())) {
            throw new IllegalArgumentException("Record " + record.key() + " does not belong to " + identity.key());
        }
        Working result = working.compute(identity.id(), (id, current) -> {
            ReconciledEntity base = current != null ? current.entity() :
                    db.findById(id).orElseGet(() -> ReconciledEntity.empty(identity));
            List<MergeConflict> conflicts = current != null ? current.conflicts() : List.of();
            return apply(base, conflicts, record);
        });
        return result.entity();
    }

    /**
     * The entity as it stands now, including merges not yet committed.
     */
    public ReconciledEntity current(SurrogateIdentity identity) {
        Working pending = working.get(identity.id());
        if (pending != null) return pending.entity();
        return db.findById(identity.id()).orElseGet(() -> ReconciledEntity.empty(identity));
    }

    /**
     * The current in-memory state of an entity and the conflicts recorded since it was last committed.
     */
    public @Nullable Working pending(UUID id) {
        return working.get(id);
    }

    /**
     * Releases entities that have been committed. An entity merged again since the snapshot was taken
     * stays in memory, minus the conflicts that were committed with the snapshot.
     */
    public void committed(Collection<Working> snapshots) {
        for (Working snapshot : snapshots) {
            UUID id = snapshot.entity().id();
            working.computeIfPresent(id, (key, current) -> {
                if (current == snapshot) return null;
                int committedConflicts = snapshot.conflicts().size();
                List<MergeConflict> remaining = current.conflicts().subList(
                        Math.min(committedConflicts, current.conflicts().size()), current.conflicts().size());
                return new Working(current.entity(), List.copyOf(remaining));
            });
        }
    }

    public int pendingCount() {
        return working.size();
    }

    static Working apply(ReconciledEntity base, List<MergeConflict> conflicts, StructuredRecord record) {
        Map<String, FieldValue> changes = new LinkedHashMap<>();
        List<MergeConflict> newConflicts = new ArrayList<>();
        Instant fetchedAt = record.fetchedAt();
        String source = record.source().name();

        for (Map.Entry<String, Object> entry : record.fields().entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            boolean authoritative = record.isAuthoritative(field);
            FieldValue incoming = new FieldValue(value, fetchedAt, source, authoritative);
            FieldValue existing = base.fields().get(field);

            if (existing == null || existing.value() == null) {
                changes.put(field, incoming);
            } else if (Objects.equals(existing.value(), value)) {
                if (authoritative && !existing.authoritative()) {
                    changes.put(field, incoming);
                }
            } else if (field.equals(StructuredRecord.FIRST_YEAR) || field.equals(StructuredRecord.LAST_YEAR)) {
                int current = ((Number) existing.value()).intValue();
                int seen = ((Number) value).intValue();
                boolean widens = field.equals(StructuredRecord.FIRST_YEAR) ? seen < current : seen > current;
                if (widens) changes.put(field, incoming);
            } else if (!authoritative) {
                log.atDebug().addKeyValue("entity", base.id()).addKeyValue("field", field)
                        .log("Ignoring non-authoritative value {} from {}", value, source);
            } else if (!existing.authoritative() || !fetchedAt.isBefore(existing.observedAt())) {
                changes.put(field, incoming);
                newConflicts.add(new MergeConflict(base.id(), field, incoming, existing, true));
                log.atWarn().addKeyValue("entity", base.id()).addKeyValue("field", field)
                        .log("{} superseded by {} from {}", existing.value(), value, source);
            } else {
                newConflicts.add(new MergeConflict(base.id(), field, existing, incoming, false));
                log.atWarn().addKeyValue("entity", base.id()).addKeyValue("field", field)
                        .log("Stale value {} from {} rejected, keeping {}", value, source, existing.value());
            }
        }

        Map<String, NaturalKey> references = base.references();
        if (!record.references().isEmpty() && !base.references().entrySet().containsAll(record.references().entrySet())) {
            var merged = new LinkedHashMap<>(base.references());
            merged.putAll(record.references());
            references = merged;
        }

        ReconciledEntity entity = base;
        if (!changes.isEmpty() || references != base.references()) {
            Instant updatedAt = base.updatedAt() == null || fetchedAt.isAfter(base.updatedAt()) ? fetchedAt : base.updatedAt();
            entity = new ReconciledEntity(base.id(), base.kind(), base.naturalKey(), base.fields().with(changes),
                    references, updatedAt);
        }
        if (newConflicts.isEmpty()) return new Working(entity, conflicts);
        var allConflicts = new ArrayList<>(conflicts);
        allConflicts.addAll(newConflicts);
        return new Working(entity, List.copyOf(allConflicts));
    }

    /**
     * An uncommitted entity and its uncommitted conflicts.
     */
    public record Working(ReconciledEntity entity, List<MergeConflict> conflicts) {
    }
}
