package org.clipcrawl.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically logs the progress of the running pass.
 */
class ProgressReporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "progress-reporter");
        thread.setDaemon(true);
        return thread;
    });
    private final Duration interval;
    private ScheduledFuture<?> reportTask;

    ProgressReporter(Duration interval) {
        this.interval = interval;
    }

    synchronized void start(Supplier<PassStatus> status) {
        stop();
        reportTask = scheduler.scheduleAtFixedRate(() -> report(status.get()),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void stop() {
        if (reportTask == null) return;
        reportTask.cancel(false);
        reportTask = null;
    }

    static void report(PassStatus status) {
        log.atInfo()
                .addKeyValue("pass", status.pass())
                .addKeyValue("state", status.state())
                .addKeyValue("remaining", status.remaining())
                .addKeyValue("inFlight", status.inFlight())
                .addKeyValue("completed", status.completed())
                .addKeyValue("failures", status.failures().size())
                .addKeyValue("commitSeq", status.checkpoint().commitSeq())
                .addKeyValue("unresolvedReferences", status.unresolvedReferences())
                .log("Progress");
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
