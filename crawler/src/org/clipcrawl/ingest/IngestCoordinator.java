package org.clipcrawl.ingest;

import org.clipcrawl.Database;
import org.clipcrawl.PersistentStore;
import org.clipcrawl.config.CrawlConfig;
import org.clipcrawl.db.CommitBatch;
import org.clipcrawl.db.CommitBatch.BlobReference;
import org.clipcrawl.db.CommitBatch.TargetOutcome;
import org.clipcrawl.db.CommitResult;
import org.clipcrawl.db.CrawlCheckpoint;
import org.clipcrawl.db.FrontierTarget;
import org.clipcrawl.db.FrontierTarget.Failure;
import org.clipcrawl.db.StoreCommitException;
import org.clipcrawl.files.ContentHash;
import org.clipcrawl.files.FileStore;
import org.clipcrawl.identity.IdentityResolver;
import org.clipcrawl.model.MergeConflict;
import org.clipcrawl.model.ReconciledEntity;
import org.clipcrawl.parse.PageParser;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.RequestDispatcher;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one ingestion pass.
 * <p>
 * Workers fetch, parse and merge targets concurrently and hand their results back here. The pass
 * thread is the only writer: whenever a batch of targets has finished it commits the merged entities,
 * newly discovered targets, target outcomes and the checkpoint advance in one transaction. Targets
 * not yet committed stay pending in the frontier, so a pass that stops for any reason can be resumed
 * without redoing committed work.
 * <p>
 * When the queue runs dry, targets that failed with a retryable failure are queued again until they
 * have been attempted {@code maxPasses} times.
 */
public class IngestCoordinator {
    private static final Logger log = LoggerFactory.getLogger(IngestCoordinator.class);
    private static final long POLL_MILLIS = 200;

    public enum State {
        IDLE, TRAVERSING, COMMITTING, CHECKPOINTED, DONE, FAILED, CANCELLED;

        public boolean isFinal() {
            return this == DONE || this == FAILED || this == CANCELLED;
        }
    }

    private final long pass;
    private final CrawlConfig config;
    private final int workerCount;
    private final Database db;
    private final RequestDispatcher dispatcher;
    private final PageParser parser;
    private final IdentityResolver resolver;
    private final FileStore fileStore;
    private final @Nullable PageArchive archive;
    private final BatchCommitter committer;

    private final LinkedBlockingQueue<CrawlTarget> queue = new LinkedBlockingQueue<>();
    private final Set<String> known = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    /**
     * Targets queued or in flight. Incremented before a target is queued and decremented once it is
     * finished, so it only reaches zero when there is no work left at all.
     */
    private final AtomicInteger outstanding = new AtomicInteger();
    private final List<CrawlWorker> workers = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private final CountDownLatch finished = new CountDownLatch(1);
    private Pending pending = new Pending(); // guarded by lock
    private volatile State state = State.IDLE;
    private volatile boolean cancelled;
    private volatile @Nullable Throwable fatal;
    private volatile CrawlCheckpoint checkpoint;

    IngestCoordinator(long pass, CrawlConfig config, int workerCount, Database db, PersistentStore store,
                      RequestDispatcher dispatcher, PageParser parser, FileStore fileStore,
                      @Nullable PageArchive archive) {
        this.pass = pass;
        this.config = config;
        this.workerCount = workerCount;
        this.db = db;
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.fileStore = fileStore;
        this.archive = archive;
        this.resolver = new IdentityResolver(db);
        this.committer = new BatchCommitter(store);
        this.checkpoint = db.checkpoint();
    }

    /**
     * Starts the pass thread.
     *
     * @param knownKeys every target already in the frontier, which won't be queued again when rediscovered
     * @param targets   targets to process
     */
    synchronized void start(Collection<String> knownKeys, List<CrawlTarget> targets) {
        if (state != State.IDLE) throw new IllegalStateException("Pass " + pass + " already started");
        known.addAll(knownKeys);
        for (CrawlTarget target : targets) {
            known.add(target.key());
            enqueue(target);
        }
        setState(State.TRAVERSING);
        for (int i = 0; i < workerCount; i++) {
            workers.add(new CrawlWorker(pass + "-" + i, this, dispatcher, parser, resolver, fileStore, archive,
                    config.maxAttachmentSize()));
        }
        for (CrawlWorker worker : workers) {
            worker.start();
        }
        Thread thread = new Thread(this::run, "Pass-" + pass);
        thread.start();
    }

    private void run() {
        log.atInfo().addKeyValue("pass", pass).addKeyValue("queued", queue.size()).log("Pass started");
        try {
            while (true) {
                Wakeup reason = awaitWakeup();
                switch (reason) {
                    case FATAL -> {
                        stopWorkers(Duration.ZERO);
                        flushQuietly();
                        finish(State.FAILED);
                        return;
                    }
                    case CANCELLED -> {
                        stopWorkers(config.gracePeriod());
                        flush();
                        finish(State.CANCELLED);
                        return;
                    }
                    case BATCH -> flush();
                    case IDLE -> {
                        flush();
                        if (!requeueRetryable()) {
                            stopWorkers(Duration.ZERO);
                            finish(State.DONE);
                            return;
                        }
                    }
                }
            }
        } catch (StoreCommitException | RuntimeException e) {
            log.atError().addKeyValue("pass", pass).setCause(e).log("Pass failed");
            if (fatal == null) fatal = e;
            stopWorkers(Duration.ZERO);
            finish(State.FAILED);
        } catch (InterruptedException e) {
            log.atWarn().addKeyValue("pass", pass).log("Pass thread interrupted");
            if (fatal == null) fatal = e;
            stopWorkers(Duration.ZERO);
            finish(State.FAILED);
        }
    }

    private enum Wakeup {FATAL, CANCELLED, BATCH, IDLE}

    private Wakeup awaitWakeup() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (fatal != null) return Wakeup.FATAL;
                if (cancelled) return Wakeup.CANCELLED;
                if (pending.outcomes.size() >= config.batchSize()) return Wakeup.BATCH;
                if (outstanding.get() == 0) return Wakeup.IDLE;
                wake.await(POLL_MILLIS, TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits everything finished so far.
     */
    private void flush() throws StoreCommitException {
        Pending batch;
        lock.lock();
        try {
            batch = pending;
            pending = new Pending();
        } finally {
            lock.unlock();
        }
        if (batch.isEmpty()) return;

        List<IdentityResolver.Working> snapshots = new ArrayList<>();
        List<ReconciledEntity> entities = new ArrayList<>();
        List<MergeConflict> conflicts = new ArrayList<>();
        for (UUID id : batch.entityIds) {
            IdentityResolver.Working working = resolver.pending(id);
            if (working == null) continue; // committed with an earlier batch
            snapshots.add(working);
            entities.add(working.entity());
            conflicts.addAll(working.conflicts());
        }

        setState(State.COMMITTING);
        CommitResult result;
        try {
            result = committer.commit(new CommitBatch(pass, entities, conflicts, batch.blobReferences,
                    batch.discovered, batch.outcomes));
        } finally {
            for (BlobReference ref : batch.blobReferences) {
                fileStore.settle(new ContentHash(ref.hash()));
            }
        }
        resolver.committed(snapshots);
        checkpoint = result.checkpoint();
        setState(State.CHECKPOINTED);

        for (String hash : result.orphanedBlobs()) {
            try {
                fileStore.delete(new ContentHash(hash));
            } catch (IOException e) {
                log.atWarn().addKeyValue("hash", hash).setCause(e).log("Failed to delete orphaned blob");
            }
        }
        log.atInfo().addKeyValue("pass", pass)
                .addKeyValue("commitSeq", checkpoint.commitSeq())
                .addKeyValue("targets", batch.outcomes.size())
                .addKeyValue("entities", entities.size())
                .addKeyValue("conflicts", conflicts.size())
                .log("Checkpointed");
        setState(State.TRAVERSING);
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (StoreCommitException | RuntimeException e) {
            log.atError().addKeyValue("pass", pass).setCause(e).log("Final commit of failed pass didn't succeed");
        }
    }

    /**
     * Queues failed targets that are worth another attempt.
     *
     * @return false if there were none
     */
    private boolean requeueRetryable() {
        List<FrontierTarget> retryable = db.frontier().findRetryable(config.maxPasses());
        if (retryable.isEmpty()) return false;
        log.atInfo().addKeyValue("pass", pass).addKeyValue("targets", retryable.size())
                .log("Retrying failed targets");
        for (FrontierTarget target : retryable) {
            enqueue(target.target());
        }
        return true;
    }

    private void stopWorkers(Duration gracePeriod) {
        for (CrawlWorker worker : workers) {
            worker.closeAsyncGraceful();
        }
        if (gracePeriod.isZero()) {
            for (CrawlWorker worker : workers) {
                worker.closeAsync();
            }
        }
        long deadline = System.nanoTime() + gracePeriod.toNanos();
        for (CrawlWorker worker : workers) {
            worker.close(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        }
    }

    private void finish(State finalState) {
        try {
            db.checkpoints().setState(finalState.name());
            checkpoint = db.checkpoint();
            var logEvent = finalState == State.DONE ? log.atInfo() : log.atWarn();
            logEvent.addKeyValue("pass", pass)
                    .addKeyValue("state", finalState)
                    .addKeyValue("failures", db.frontier().count(FrontierTarget.State.FAILED))
                    .addKeyValue("commitSeq", checkpoint.commitSeq())
                    .log(fatal == null ? "Pass finished" : "Pass finished: " + fatal.getMessage());
        } catch (RuntimeException e) {
            log.atError().addKeyValue("pass", pass).setCause(e).log("Unable to record final state {}", finalState);
        } finally {
            setState(finalState);
            finished.countDown();
        }
    }

    private void setState(State state) {
        this.state = state;
        if (state != State.DONE && state != State.FAILED && state != State.CANCELLED) {
            try {
                db.checkpoints().setState(state.name());
            } catch (RuntimeException e) {
                log.atWarn().setCause(e).log("Unable to record state {}", state);
            }
        }
    }

    // called by workers

    /**
     * Takes the next target, counting it as in flight. Returns null if none arrived within a short wait.
     */
    @Nullable CrawlTarget take() throws InterruptedException {
        if (cancelled || fatal != null) {
            Thread.sleep(POLL_MILLIS);
            return null;
        }
        CrawlTarget target = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (target != null) inFlight.incrementAndGet();
        return target;
    }

    void complete(CrawlTarget target, Collection<UUID> entityIds, List<BlobReference> blobReferences,
                  List<CrawlTarget> discovered) {
        List<CrawlTarget> fresh = new ArrayList<>();
        for (CrawlTarget child : discovered) {
            if (known.add(child.key())) fresh.add(child);
        }
        lock.lock();
        try {
            pending.entityIds.addAll(entityIds);
            pending.blobReferences.addAll(blobReferences);
            pending.discovered.addAll(fresh);
            pending.outcomes.add(TargetOutcome.completed(target));
        } finally {
            lock.unlock();
        }
        // queued only once recorded, so a child's outcome never commits before the row it updates
        for (CrawlTarget child : fresh) {
            enqueue(child);
        }
        release();
    }

    void fail(CrawlTarget target, Failure failure, String error) {
        lock.lock();
        try {
            pending.outcomes.add(TargetOutcome.failed(target, failure, error));
        } finally {
            lock.unlock();
        }
        release();
    }

    /**
     * Gives up on a target without an outcome. It stays pending in the frontier.
     */
    void abandon(CrawlTarget target) {
        log.atDebug().addKeyValue("target", target.key()).log("Abandoned");
        release();
    }

    void abort(Throwable cause) {
        lock.lock();
        try {
            if (fatal == null) {
                fatal = cause;
                log.atError().addKeyValue("pass", pass).log("Aborting pass: {}", cause.getMessage());
            }
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(CrawlTarget target) {
        outstanding.incrementAndGet();
        queue.add(target);
    }

    private void release() {
        inFlight.decrementAndGet();
        outstanding.decrementAndGet();
        lock.lock();
        try {
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // control surface

    void cancel() {
        lock.lock();
        try {
            cancelled = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    State await() throws InterruptedException {
        finished.await();
        return state;
    }

    boolean await(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long pass() {
        return pass;
    }

    public State state() {
        return state;
    }

    public @Nullable Throwable failure() {
        return fatal;
    }

    public CrawlCheckpoint checkpoint() {
        return checkpoint;
    }

    long queued() {
        return queue.size();
    }

    int inFlight() {
        return Math.max(0, inFlight.get());
    }

    List<CrawlWorker.Info> workerInfo() {
        List<CrawlWorker.Info> infos = new ArrayList<>();
        for (CrawlWorker worker : workers) {
            infos.add(worker.info());
        }
        return infos;
    }

    private static class Pending {
        final Set<UUID> entityIds = new LinkedHashSet<>();
        final List<BlobReference> blobReferences = new ArrayList<>();
        final List<CrawlTarget> discovered = new ArrayList<>();
        final List<TargetOutcome> outcomes = new ArrayList<>();

        boolean isEmpty() {
            return entityIds.isEmpty() && outcomes.isEmpty() && discovered.isEmpty();
        }
    }
}
