package org.clipcrawl;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.clipcrawl.db.*;
import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.FieldSet;
import org.clipcrawl.model.FieldValue;
import org.clipcrawl.model.MergeConflict;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.ReconciledEntity;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.util.Json;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * SQLite-backed store. The pool holds a single connection so every transaction, and in particular
 * every commit, runs strictly one after another.
 */
public interface Database extends PersistentStore, AutoCloseable, Transactional<Database> {
    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA synchronous = NORMAL; PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        config.setMaximumPoolSize(1);
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(UUID.class, stringColumnMapper(UUID::fromString));
        jdbi.registerColumnMapper(FieldSet.class, stringColumnMapper(json -> Json.read(json, FieldSet.class)));
        jdbi.registerArgument(stringArgument(UUID.class, UUID::toString));
        jdbi.registerArgument(stringArgument(FieldSet.class, Json::write));
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                var durationMillis = Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    private static <T> ColumnMapper<T> stringColumnMapper(Function<String, T> constructor) {
        return (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : constructor.apply(value);
        };
    }

    @SuppressWarnings("unchecked")
    private static <T> ArgumentFactory.Preparable stringArgument(Class<T> clazz, Function<T, String> getter) {
        return (type, config) -> {
            if (!clazz.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.VARCHAR);
                return (pos, stmt, ctx) -> stmt.setString(pos, getter.apply((T) value));
            });
        };
    }

    default void init() {
        // @SqlScript can't be used as sqlite needs executeAsSeparateStatements()
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes(), UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    BlobDAO blobs();

    @CreateSqlObject
    CheckpointDAO checkpoints();

    @CreateSqlObject
    ConflictDAO conflicts();

    @CreateSqlObject
    EntityDAO entities();

    @CreateSqlObject
    FrontierDAO frontier();

    @CreateSqlObject
    IdentityDAO identities();

    @CreateSqlObject
    ReferenceDAO references();

    @Override
    default Optional<ReconciledEntity> findById(UUID id) {
        return Optional.ofNullable(entities().findById(id));
    }

    @Override
    default Optional<ReconciledEntity> findByNaturalKey(EntityKind kind, String naturalKey) {
        return Optional.ofNullable(entities().findByNaturalKey(kind, naturalKey));
    }

    @Override
    default List<ReconciledEntity> search(String text, @Nullable EntityKind kind, int limit) {
        String escaped = text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
        return entities().search(escaped, kind, limit);
    }

    @Override
    default List<EntityReference> references(UUID entityId) {
        return references().findByEntity(entityId);
    }

    @Override
    default CrawlCheckpoint checkpoint() {
        return checkpoints().current();
    }

    @Override
    default CommitResult commit(CommitBatch batch) throws StoreCommitException {
        try {
            return inTransaction(tx -> tx.applyCommit(batch));
        } catch (JdbiException e) {
            throw new StoreCommitException("Commit of " + batch.outcomes().size() + " targets failed", e);
        }
    }

    /**
     * Writes a batch. Only call within a transaction, see {@link #commit(CommitBatch)}.
     */
    default CommitResult applyCommit(CommitBatch batch) {
        Instant now = Instant.now();
        for (CrawlTarget target : batch.discovered()) {
            frontier().insertIfAbsent(target.key(), target.kind(), target.via(), batch.pass(), now);
        }
        for (ReconciledEntity entity : batch.entities()) {
            entities().upsert(entity.id(), entity.kind(), entity.naturalKey(), entity.name(),
                    Json.write(entity.fields()), Json.write(entity.references()), entity.updatedAt());
            for (Map.Entry<String, NaturalKey> ref : entity.references().entrySet()) {
                references().upsert(entity.id(), ref.getKey(), ref.getValue().kind(), ref.getValue().value());
            }
        }
        references().resolvePending();
        for (MergeConflict conflict : batch.conflicts()) {
            FieldValue kept = conflict.kept();
            FieldValue discarded = conflict.discarded();
            conflicts().insert(conflict.entityId(), conflict.field(),
                    stringValue(kept.value()), kept.source(), kept.observedAt(),
                    stringValue(discarded.value()), discarded.source(), discarded.observedAt(),
                    conflict.superseded(), now);
        }
        List<String> orphaned = new ArrayList<>();
        for (CommitBatch.BlobReference ref : batch.blobReferences()) {
            blobs().addReference(ref.hash(), ref.referrer());
            if (ref.replaces() != null && !ref.replaces().equals(ref.hash())) {
                if (blobs().removeReference(ref.replaces(), ref.referrer())) {
                    orphaned.add(ref.replaces());
                }
            }
        }
        for (CommitBatch.TargetOutcome outcome : batch.outcomes()) {
            frontier().updateState(outcome.targetKey(), outcome.state(), outcome.failure(), outcome.error(), now);
        }
        checkpoints().advance(now, batch.lastTarget());
        return new CommitResult(checkpoints().current(), orphaned);
    }

    private static @Nullable String stringValue(@Nullable Object value) {
        return value == null ? null : value.toString();
    }

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
