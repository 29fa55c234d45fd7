package org.clipcrawl.files;

import org.clipcrawl.Database;
import org.clipcrawl.db.FileBlob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed store for downloaded attachments. Identical bytes are kept once no matter how many
 * entities refer to them; the blob table counts distinct referrers.
 * <p>
 * Bytes are written under {@code root/ab/cdef...} via a temporary file and an atomic rename, so a
 * blob file either holds the complete content or doesn't exist. Reference counts live in the
 * database, where adding a reference is a single serialized transaction.
 * <p>
 * Writing and deleting the same content are serialized by a lock striped on the hash. Content handed
 * out by {@link #put} is claimed until the caller {@link #settle settles} it, and claimed content is
 * never deleted, so bytes can't vanish between a worker storing them and its reference being committed.
 */
public class FileStore {
    private static final Logger log = LoggerFactory.getLogger(FileStore.class);
    private static final int STRIPES = 64;
    private final Path root;
    private final Database db;
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];
    private final Map<String, Integer> claims = new ConcurrentHashMap<>();

    public FileStore(Path root, Database db) throws IOException {
        this.root = root;
        this.db = db;
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        Files.createDirectories(root);
    }

    /**
     * Writes the bytes if no blob with the same content exists yet. Does not add a reference, the
     * caller is expected to commit one and then call {@link #settle}.
     */
    public ContentHash put(byte[] data) throws IOException {
        ContentHash hash = ContentHash.of(data);
        ReentrantLock lock = lockFor(hash);
        lock.lock();
        try {
            claims.merge(hash.hex(), 1, Integer::sum);
            write(hash, data);
            db.blobs().insertIfAbsent(hash.hex(), data.length, Instant.now());
        } finally {
            lock.unlock();
        }
        return hash;
    }

    /**
     * Drops the claim taken by {@link #put} once the reference to the content has been committed, or
     * will never be.
     */
    public void settle(ContentHash hash) {
        claims.computeIfPresent(hash.hex(), (key, count) -> count > 1 ? count - 1 : null);
    }

    boolean claimed(ContentHash hash) {
        return claims.containsKey(hash.hex());
    }

    private void write(ContentHash hash, byte[] data) throws IOException {
        Path path = path(hash);
        if (!Files.exists(path)) {
            Files.createDirectories(path.getParent());
            Path tmp = Files.createTempFile(path.getParent(), ".blob", ".tmp");
            try {
                Files.write(tmp, data);
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.atDebug().addKeyValue("hash", hash).addKeyValue("length", data.length).log("Stored new blob");
        }
    }

    /**
     * Stores the bytes and records {@code referrer} as referring to them. Storing the same content again
     * for the same referrer leaves the count unchanged.
     */
    public ContentHash store(byte[] data, String referrer) throws IOException {
        ContentHash hash = put(data);
        try {
            db.useTransaction(tx -> tx.blobs().addReference(hash.hex(), referrer));
        } finally {
            settle(hash);
        }
        return hash;
    }

    public byte[] retrieve(ContentHash hash) throws IOException {
        try {
            return Files.readAllBytes(path(hash));
        } catch (NoSuchFileException e) {
            throw new NoSuchFileException("No blob " + hash);
        }
    }

    public boolean contains(ContentHash hash) {
        return Files.exists(path(hash));
    }

    public FileBlob blob(ContentHash hash) {
        return db.blobs().find(hash.hex());
    }

    /**
     * Drops {@code referrer}'s reference, deleting the bytes once nothing refers to them.
     *
     * @return true if the blob was deleted
     */
    public boolean release(ContentHash hash, String referrer) throws IOException {
        boolean orphaned = db.inTransaction(tx -> tx.blobs().removeReference(hash.hex(), referrer));
        if (orphaned) delete(hash);
        return orphaned;
    }

    /**
     * Deletes the bytes of a blob whose last reference has been released in a commit. Does nothing if
     * the same content has been stored again since, or is claimed by a reference not yet committed.
     */
    public void delete(ContentHash hash) throws IOException {
        ReentrantLock lock = lockFor(hash);
        lock.lock();
        try {
            if (claimed(hash) || db.blobs().find(hash.hex()) != null) return;
            if (Files.deleteIfExists(path(hash))) {
                log.atInfo().addKeyValue("hash", hash).log("Deleted unreferenced blob");
            }
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(ContentHash hash) {
        return locks[Math.floorMod(hash.hex().hashCode(), STRIPES)];
    }

    Path path(ContentHash hash) {
        return root.resolve(hash.relativePath());
    }
}
