package org.clipcrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

@RegisterConstructorMapper(CrawlCheckpoint.class)
public interface CheckpointDAO {
    @SqlQuery("SELECT pass, commit_seq, committed_at, last_target, state FROM checkpoint WHERE id = 0")
    CrawlCheckpoint current();

    @SqlUpdate("UPDATE checkpoint SET pass = pass + 1, commit_seq = 0, committed_at = NULL, last_target = NULL, state = :state WHERE id = 0")
    void startPass(String state);

    @SqlUpdate("""
            UPDATE checkpoint
            SET commit_seq = commit_seq + 1, committed_at = :committedAt,
                last_target = coalesce(:lastTarget, last_target)
            WHERE id = 0
            """)
    void advance(Instant committedAt, @Nullable String lastTarget);

    @SqlUpdate("UPDATE checkpoint SET state = ? WHERE id = 0")
    void setState(String state);
}
