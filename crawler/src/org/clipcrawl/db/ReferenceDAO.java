package org.clipcrawl.db;

import org.clipcrawl.model.EntityKind;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(EntityReference.class)
public interface ReferenceDAO {
    @SqlUpdate("""
            INSERT INTO entity_references (entity_id, field, target_kind, target_key, target_id)
            VALUES (:entityId, :field, :targetKind, :targetKey,
                    (SELECT id FROM entities WHERE kind = :targetKind AND natural_key = :targetKey))
            ON CONFLICT (entity_id, field) DO UPDATE SET target_kind = excluded.target_kind,
                                                         target_key = excluded.target_key,
                                                         target_id = excluded.target_id
            """)
    void upsert(UUID entityId, String field, EntityKind targetKind, String targetKey);

    @SqlUpdate("DELETE FROM entity_references WHERE entity_id = :entityId AND field = :field")
    void delete(UUID entityId, String field);

    /**
     * Points forward references at targets that have since been committed.
     */
    @SqlUpdate("""
            UPDATE entity_references
            SET target_id = (SELECT e.id FROM entities e
                             WHERE e.kind = entity_references.target_kind
                               AND e.natural_key = entity_references.target_key)
            WHERE target_id IS NULL
              AND EXISTS (SELECT 1 FROM entities e
                          WHERE e.kind = entity_references.target_kind
                            AND e.natural_key = entity_references.target_key)
            """)
    int resolvePending();

    @SqlQuery("SELECT * FROM entity_references WHERE entity_id = ? ORDER BY field")
    List<EntityReference> findByEntity(UUID entityId);

    @SqlQuery("SELECT * FROM entity_references WHERE target_id IS NULL ORDER BY target_kind, target_key LIMIT ?")
    List<EntityReference> findUnresolved(int limit);

    @SqlQuery("SELECT COUNT(*) FROM entity_references WHERE target_id IS NULL")
    long countUnresolved();
}
