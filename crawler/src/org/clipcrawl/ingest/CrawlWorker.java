package org.clipcrawl.ingest;

import org.clipcrawl.db.CommitBatch.BlobReference;
import org.clipcrawl.db.FrontierTarget.Failure;
import org.clipcrawl.files.ContentHash;
import org.clipcrawl.files.FileStore;
import org.clipcrawl.identity.IdentityResolver;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.model.SurrogateIdentity;
import org.clipcrawl.parse.PageParser;
import org.clipcrawl.parse.ParseException;
import org.clipcrawl.parse.ParseResult;
import org.clipcrawl.portal.AuthenticationException;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.FetchException;
import org.clipcrawl.portal.RawPage;
import org.clipcrawl.portal.RequestDispatcher;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Takes targets from the coordinator and runs fetch, parse and merge for each. Results are handed
 * back to the coordinator, which commits them.
 */
class CrawlWorker {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);
    static final String CONTENT_HASH = "content_hash";
    final String id;
    private final IngestCoordinator coordinator;
    private final RequestDispatcher dispatcher;
    private final PageParser parser;
    private final IdentityResolver resolver;
    private final FileStore fileStore;
    private final @Nullable PageArchive archive;
    private final long maxAttachmentSize;
    private Thread thread;
    private volatile boolean closed = false;
    private volatile Info info;

    CrawlWorker(String id, IngestCoordinator coordinator, RequestDispatcher dispatcher, PageParser parser,
                IdentityResolver resolver, FileStore fileStore, @Nullable PageArchive archive,
                long maxAttachmentSize) {
        this.id = id;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.resolver = resolver;
        this.fileStore = fileStore;
        this.archive = archive;
        this.maxAttachmentSize = maxAttachmentSize;
        this.info = new Info(id, null, Instant.now());
    }

    synchronized void start() {
        log.debug("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (Exception e) {
                log.error("Worker {} crashed", id, e);
                coordinator.abort(e);
            }
        }, "Worker-" + id);
        thread.start();
    }

    /**
     * Stops taking new targets. The current target is allowed to finish.
     */
    void closeAsyncGraceful() {
        closed = true;
    }

    void closeAsync() {
        closed = true;
        Thread thread = this.thread;
        if (thread != null) thread.interrupt();
    }

    /**
     * Waits for the worker to exit, interrupting it if it hasn't within the grace period.
     */
    void close(Duration gracePeriod) {
        closeAsyncGraceful();
        Thread thread = this.thread;
        if (thread == null || thread == Thread.currentThread()) return;
        try {
            thread.join(Math.max(1, gracePeriod.toMillis()));
            if (thread.isAlive()) {
                log.info("Interrupting worker {} after grace period", id);
                closeAsync();
                thread.join(10000);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for worker {} to close", id);
            Thread.currentThread().interrupt();
        }
    }

    private void run() {
        while (!closed) {
            CrawlTarget target;
            try {
                target = coordinator.take();
            } catch (InterruptedException e) {
                return;
            }
            if (target == null) continue;
            info = new Info(id, target.key(), Instant.now());
            try {
                process(target);
            } finally {
                info = new Info(id, null, Instant.now());
            }
        }
    }

    void process(CrawlTarget target) {
        log.atDebug().addKeyValue("target", target.key()).addKeyValue("worker", id).log("Fetching");
        RawPage page;
        try {
            page = dispatcher.fetch(target);
        } catch (FetchException e) {
            Failure failure = e.kind() == FetchException.Kind.TRANSIENT ? Failure.TRANSIENT : Failure.TERMINAL;
            log.atWarn().addKeyValue("target", target.key()).addKeyValue("attempts", e.attempts())
                    .log("{} fetch failure: {}", failure, e.getMessage());
            coordinator.fail(target, failure, e.getMessage());
            return;
        } catch (AuthenticationException e) {
            coordinator.abandon(target);
            coordinator.abort(e);
            return;
        } catch (InterruptedException e) {
            coordinator.abandon(target);
            Thread.currentThread().interrupt();
            closed = true;
            return;
        }

        if (page.content().length > maxAttachmentSize) {
            coordinator.fail(target, Failure.TERMINAL, "Content of " + page.content().length +
                                                       " bytes exceeds the limit of " + maxAttachmentSize);
            return;
        }

        ParseResult result;
        try {
            result = parser.parse(page);
        } catch (ParseException e) {
            log.atWarn().addKeyValue("target", target.key()).log("Parse failure: {}", e.getMessage());
            archive(page, e.getMessage());
            coordinator.fail(target, Failure.PARSE, e.getMessage());
            return;
        }

        List<ContentHash> stored = new ArrayList<>();
        try {
            Set<UUID> touched = new LinkedHashSet<>();
            List<BlobReference> blobReferences = new ArrayList<>();
            for (ParseResult.Attachment attachment : result.attachments()) {
                ContentHash hash = fileStore.put(attachment.content());
                stored.add(hash);
                SurrogateIdentity owner = resolver.resolve(attachment.owner());
                Object previous = resolver.current(owner).value(CONTENT_HASH);
                resolver.merge(owner, StructuredRecord.builder(attachment.owner())
                        .authoritativeField(CONTENT_HASH, hash.hex())
                        .source(target.kind(), page.fetchedAt())
                        .build());
                touched.add(owner.id());
                blobReferences.add(new BlobReference(hash.hex(), owner.id().toString(),
                        previous == null ? null : previous.toString()));
            }
            for (StructuredRecord record : result.records()) {
                SurrogateIdentity identity = resolver.resolve(record);
                resolver.merge(identity, record);
                touched.add(identity.id());
            }
            coordinator.complete(target, touched, blobReferences, result.discovered());
            stored.clear(); // settled by the coordinator once committed
            log.atDebug().addKeyValue("target", target.key()).addKeyValue("records", result.records().size())
                    .addKeyValue("discovered", result.discovered().size()).log("Completed");
        } catch (IOException | RuntimeException e) {
            log.atError().addKeyValue("target", target.key()).setCause(e).log("Failed to ingest page");
            stored.forEach(fileStore::settle);
            coordinator.fail(target, Failure.TRANSIENT, e.toString());
        }
    }

    private void archive(RawPage page, String error) {
        if (archive == null) return;
        try {
            archive.save(page, error);
        } catch (IOException e) {
            log.atWarn().addKeyValue("target", page.target().key()).setCause(e).log("Failed to archive page");
        }
    }

    Info info() {
        return info;
    }

    record Info(String id, @Nullable String target, Instant updateTime) {
    }
}
