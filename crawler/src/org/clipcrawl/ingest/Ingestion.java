package org.clipcrawl.ingest;

import org.clipcrawl.Database;
import org.clipcrawl.PersistentStore;
import org.clipcrawl.config.JobConfig;
import org.clipcrawl.db.CrawlCheckpoint;
import org.clipcrawl.db.FrontierTarget;
import org.clipcrawl.files.FileStore;
import org.clipcrawl.parse.PageParser;
import org.clipcrawl.parse.PageParsers;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.RateLimiter;
import org.clipcrawl.portal.RequestDispatcher;
import org.clipcrawl.portal.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operational control surface of a job: starts and resumes passes and reports their status. At most
 * one pass runs at a time.
 * <p>
 * A job directory holds the database, the content-addressed files and the archive of pages that
 * failed to parse.
 */
public class Ingestion implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Ingestion.class);
    private final JobConfig config;
    private final Database db;
    private final PersistentStore store;
    private final FileStore fileStore;
    private final PageArchive archive;
    private final SessionManager sessionManager;
    private final RequestDispatcher dispatcher;
    private final PageParser parser;
    private final ProgressReporter progressReporter;
    private final Lock startStopLock = new ReentrantLock();
    private IngestCoordinator current;

    public Ingestion(Path jobDir, JobConfig config) throws IOException {
        this(jobDir, config, new PageParsers());
    }

    Ingestion(Path jobDir, JobConfig config, PageParser parser) throws IOException {
        this(jobDir, config, parser, db -> db);
    }

    /**
     * @param store chooses the store batches are committed to, given the job's database
     */
    Ingestion(Path jobDir, JobConfig config, PageParser parser, Function<Database, PersistentStore> store)
            throws IOException {
        Files.createDirectories(jobDir);
        this.config = config;
        this.db = Database.open(jobDir.resolve("db.sqlite3"));
        this.store = store.apply(db);
        this.fileStore = new FileStore(jobDir.resolve("files"), db);
        this.archive = new PageArchive(jobDir.resolve("failed"), config.storage().prefix(), config.portal().baseUrl());
        this.sessionManager = new SessionManager(config.portal());
        this.dispatcher = new RequestDispatcher(config.portal(), config.fetch(), sessionManager,
                new RateLimiter(config.fetch().requestsPerSecond(), config.fetch().burst()));
        this.parser = parser;
        this.progressReporter = new ProgressReporter(config.crawl().progressInterval());
    }

    /**
     * Starts a fresh pass from the configured seeds. Entities and blobs from earlier passes are kept
     * and merged into; the frontier starts over.
     */
    public PassHandle startIngestion() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Ingestion busy");
        try {
            checkIdle();
            List<CrawlTarget> seeds = Seeds.of(config.crawl());
            db.useTransaction(tx -> {
                tx.frontier().clear();
                tx.checkpoints().startPass(IngestCoordinator.State.IDLE.name());
                long pass = tx.checkpoints().current().pass();
                Instant now = Instant.now();
                for (CrawlTarget seed : seeds) {
                    tx.frontier().insertIfAbsent(seed.key(), seed.kind(), null, pass, now);
                }
            });
            long pass = db.checkpoint().pass();
            log.atInfo().addKeyValue("pass", pass).addKeyValue("seeds", seeds.size()).log("Starting ingestion");
            return launch(pass, List.of(), seeds);
        } finally {
            startStopLock.unlock();
        }
    }

    /**
     * Continues the pass recorded by the checkpoint. Only targets that were never committed, plus
     * failed targets that are still retryable, are processed.
     *
     * @throws BadStateException if the checkpoint isn't the store's latest or a pass is running
     */
    public PassHandle resumeIngestion(CrawlCheckpoint checkpoint) throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Ingestion busy");
        try {
            checkIdle();
            CrawlCheckpoint latest = db.checkpoint();
            if (latest.pass() == 0) throw new BadStateException("Nothing to resume, no pass has been started");
            if (checkpoint.pass() != latest.pass() || checkpoint.commitSeq() != latest.commitSeq()) {
                throw new BadStateException("Checkpoint " + checkpoint.pass() + "/" + checkpoint.commitSeq() +
                                            " is not the latest (" + latest.pass() + "/" + latest.commitSeq() + ")");
            }
            List<CrawlTarget> targets = new ArrayList<>();
            for (FrontierTarget target : db.frontier().findPending()) {
                targets.add(target.target());
            }
            for (FrontierTarget target : db.frontier().findRetryable(config.crawl().maxPasses())) {
                targets.add(target.target());
            }
            log.atInfo().addKeyValue("pass", latest.pass()).addKeyValue("commitSeq", latest.commitSeq())
                    .addKeyValue("targets", targets.size()).log("Resuming ingestion");
            return launch(latest.pass(), db.frontier().keys(), targets);
        } finally {
            startStopLock.unlock();
        }
    }

    private PassHandle launch(long pass, List<String> knownKeys, List<CrawlTarget> targets) {
        var coordinator = new IngestCoordinator(pass, config.crawl(), config.fetch().workers(), db, store,
                dispatcher, parser, fileStore, archive);
        current = coordinator;
        var handle = new PassHandle(coordinator);
        coordinator.start(knownKeys, targets);
        progressReporter.start(() -> status(handle));
        return handle;
    }

    private void checkIdle() throws BadStateException {
        if (current != null && !current.state().isFinal()) {
            throw new BadStateException("Pass " + current.pass() + " is " + current.state());
        }
    }

    public PassStatus status(PassHandle handle) {
        IngestCoordinator coordinator = handle.coordinator();
        Throwable failure = coordinator.failure();
        return new PassStatus(
                coordinator.pass(),
                coordinator.state(),
                coordinator.queued(),
                coordinator.inFlight(),
                db.frontier().count(FrontierTarget.State.COMPLETED),
                db.frontier().findFailed(),
                db.checkpoint(),
                db.references().countUnresolved(),
                failure == null ? null : failure.getMessage());
    }

    /**
     * Waits for the pass to end, then logs its final status and stops progress reporting.
     */
    public PassStatus await(PassHandle handle) throws InterruptedException {
        handle.await();
        progressReporter.stop();
        PassStatus status = status(handle);
        ProgressReporter.report(status);
        return status;
    }

    public Database db() {
        return db;
    }

    public FileStore fileStore() {
        return fileStore;
    }

    public SessionManager sessionManager() {
        return sessionManager;
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            IngestCoordinator coordinator = current;
            if (coordinator != null && !coordinator.state().isFinal()) {
                coordinator.cancel();
                try {
                    coordinator.await();
                } catch (InterruptedException e) {
                    log.warn("Interrupted while waiting for pass {} to stop", coordinator.pass());
                    Thread.currentThread().interrupt();
                }
            }
            progressReporter.close();
            try {
                archive.close();
            } catch (IOException e) {
                log.error("Failed to close page archive", e);
            }
            try {
                db.close();
            } catch (Exception e) {
                log.error("Failed to close database", e);
            }
        } finally {
            startStopLock.unlock();
        }
    }

    /**
     * The job was not in an appropriate state for this action.
     */
    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
