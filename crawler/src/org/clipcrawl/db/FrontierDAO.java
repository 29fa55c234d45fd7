package org.clipcrawl.db;

import org.clipcrawl.portal.PageKind;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(FrontierTarget.class)
public interface FrontierDAO {
    @SqlUpdate("""
            INSERT INTO frontier (target_key, kind, via, state, pass, discovered_at)
            VALUES (:targetKey, :kind, :via, 'PENDING', :pass, :discoveredAt)
            ON CONFLICT (target_key) DO NOTHING
            """)
    int insertIfAbsent(String targetKey, PageKind kind, @Nullable String via, long pass, Instant discoveredAt);

    @SqlUpdate("""
            UPDATE frontier
            SET state = :state,
                failure = :failure,
                error = :error,
                attempts = attempts + iif(:state = 'FAILED', 1, 0),
                completed_at = :completedAt
            WHERE target_key = :targetKey
            """)
    int updateState(String targetKey, FrontierTarget.State state, @Nullable FrontierTarget.Failure failure,
                    @Nullable String error, Instant completedAt);

    @SqlQuery("SELECT * FROM frontier WHERE target_key = ?")
    FrontierTarget find(String targetKey);

    @SqlQuery("SELECT * FROM frontier WHERE state = 'PENDING' ORDER BY discovered_at, target_key")
    List<FrontierTarget> findPending();

    /**
     * Failed targets worth another try: not terminal and attempted fewer than {@code maxAttempts} times.
     */
    @SqlQuery("""
            SELECT * FROM frontier
            WHERE state = 'FAILED' AND failure != 'TERMINAL' AND attempts < :maxAttempts
            ORDER BY discovered_at, target_key
            """)
    List<FrontierTarget> findRetryable(int maxAttempts);

    @SqlQuery("SELECT * FROM frontier WHERE state = 'FAILED' ORDER BY target_key")
    List<FrontierTarget> findFailed();

    @SqlQuery("SELECT target_key FROM frontier")
    List<String> keys();

    @SqlQuery("SELECT COUNT(*) FROM frontier WHERE state = ?")
    long count(FrontierTarget.State state);

    @SqlUpdate("DELETE FROM frontier")
    void clear();
}
