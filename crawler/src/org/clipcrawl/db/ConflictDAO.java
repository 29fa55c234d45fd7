package org.clipcrawl.db;

import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ConflictDAO {
    @SqlUpdate("""
            INSERT INTO merge_conflicts (entity_id, field, kept_value, kept_source, kept_observed_at,
                                         discarded_value, discarded_source, discarded_observed_at,
                                         superseded, recorded_at)
            VALUES (:entityId, :field, :keptValue, :keptSource, :keptObservedAt,
                    :discardedValue, :discardedSource, :discardedObservedAt, :superseded, :recordedAt)
            """)
    void insert(UUID entityId, String field, @Nullable String keptValue, String keptSource, Instant keptObservedAt,
                @Nullable String discardedValue, String discardedSource, Instant discardedObservedAt,
                boolean superseded, Instant recordedAt);

    @SqlQuery("SELECT discarded_value FROM merge_conflicts WHERE entity_id = :entityId AND field = :field ORDER BY id")
    List<String> discardedValues(UUID entityId, String field);

    @SqlQuery("SELECT COUNT(*) FROM merge_conflicts WHERE entity_id = ?")
    long count(UUID entityId);
}
