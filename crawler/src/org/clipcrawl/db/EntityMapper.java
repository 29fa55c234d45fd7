package org.clipcrawl.db;

import com.fasterxml.jackson.core.type.TypeReference;
import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.FieldSet;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.ReconciledEntity;
import org.clipcrawl.util.Json;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Map;
import java.util.UUID;

public class EntityMapper implements RowMapper<ReconciledEntity> {
    private static final TypeReference<Map<String, NaturalKey>> REFS = new TypeReference<>() {
    };

    @Override
    public ReconciledEntity map(ResultSet rs, StatementContext ctx) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new ReconciledEntity(
                UUID.fromString(rs.getString("id")),
                EntityKind.valueOf(rs.getString("kind")),
                rs.getString("natural_key"),
                Json.read(rs.getString("fields"), FieldSet.class),
                Json.read(rs.getString("refs"), REFS),
                updatedAt == null ? null : updatedAt.toInstant());
    }
}
