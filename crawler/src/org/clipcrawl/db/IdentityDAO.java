package org.clipcrawl.db;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.SurrogateIdentity;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.UUID;

@RegisterConstructorMapper(SurrogateIdentity.class)
public interface IdentityDAO {
    @SqlUpdate("""
            INSERT INTO identities (id, kind, natural_key, created_at)
            VALUES (:id, :kind, :naturalKey, :createdAt)
            ON CONFLICT (kind, natural_key) DO NOTHING
            """)
    int insertIfAbsent(UUID id, EntityKind kind, String naturalKey, Instant createdAt);

    @SqlQuery("SELECT id, kind, natural_key FROM identities WHERE kind = :kind AND natural_key = :naturalKey")
    SurrogateIdentity find(EntityKind kind, String naturalKey);

    @SqlQuery("SELECT id, kind, natural_key FROM identities WHERE id = ?")
    SurrogateIdentity findById(UUID id);

    @SqlQuery("SELECT COUNT(*) FROM identities WHERE kind = ?")
    long count(EntityKind kind);
}
