package org.clipcrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;

@RegisterConstructorMapper(FileBlob.class)
public interface BlobDAO {
    @SqlUpdate("INSERT INTO blobs (hash, length, refs, created_at) VALUES (:hash, :length, 0, :createdAt) ON CONFLICT (hash) DO NOTHING")
    int insertIfAbsent(String hash, long length, Instant createdAt);

    @SqlUpdate("INSERT INTO blob_refs (hash, referrer) VALUES (:hash, :referrer) ON CONFLICT DO NOTHING")
    int insertRef(String hash, String referrer);

    @SqlUpdate("DELETE FROM blob_refs WHERE hash = :hash AND referrer = :referrer")
    int deleteRef(String hash, String referrer);

    @SqlUpdate("UPDATE blobs SET refs = refs + :delta WHERE hash = :hash")
    void adjustRefs(String hash, int delta);

    @SqlUpdate("DELETE FROM blobs WHERE hash = ? AND refs <= 0")
    int deleteIfUnreferenced(String hash);

    @SqlQuery("SELECT * FROM blobs WHERE hash = ?")
    FileBlob find(String hash);

    @SqlQuery("SELECT COUNT(*) FROM blobs")
    long count();

    /**
     * Adds a reference unless this referrer already holds one.
     *
     * @return true if the reference count went up
     */
    default boolean addReference(String hash, String referrer) {
        if (insertRef(hash, referrer) == 0) return false;
        adjustRefs(hash, 1);
        return true;
    }

    /**
     * Drops a referrer's reference.
     *
     * @return true if that was the last reference and the blob row was removed
     */
    default boolean removeReference(String hash, String referrer) {
        if (deleteRef(hash, referrer) == 0) return false;
        adjustRefs(hash, -1);
        return deleteIfUnreferenced(hash) > 0;
    }
}
