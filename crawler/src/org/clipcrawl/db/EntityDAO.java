package org.clipcrawl.db;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.ReconciledEntity;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RegisterRowMapper(EntityMapper.class)
public interface EntityDAO {
    @SqlUpdate("""
            INSERT INTO entities (id, kind, natural_key, name, fields, refs, updated_at)
            VALUES (:id, :kind, :naturalKey, :name, :fields, :refs, :updatedAt)
            ON CONFLICT (id) DO UPDATE SET name = excluded.name,
                                           fields = excluded.fields,
                                           refs = excluded.refs,
                                           updated_at = excluded.updated_at
            """)
    void upsert(UUID id, EntityKind kind, String naturalKey, @Nullable String name, String fields, String refs,
                @Nullable Instant updatedAt);

    @SqlQuery("SELECT * FROM entities WHERE id = ?")
    ReconciledEntity findById(UUID id);

    @SqlQuery("SELECT * FROM entities WHERE kind = :kind AND natural_key = :naturalKey")
    ReconciledEntity findByNaturalKey(EntityKind kind, String naturalKey);

    @SqlQuery("""
            SELECT * FROM entities
            WHERE name LIKE '%' || :text || '%' ESCAPE '!'
              AND (:kind IS NULL OR kind = :kind)
            ORDER BY name, id
            LIMIT :limit
            """)
    List<ReconciledEntity> search(String text, @Nullable EntityKind kind, int limit);

    @SqlQuery("SELECT COUNT(*) FROM entities WHERE kind = ?")
    long count(EntityKind kind);

    @SqlQuery("SELECT COUNT(*) FROM entities")
    long countAll();
}
