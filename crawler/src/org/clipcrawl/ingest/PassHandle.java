package org.clipcrawl.ingest;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * A running or finished pass.
 */
public class PassHandle {
    private final IngestCoordinator coordinator;

    PassHandle(IngestCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public long pass() {
        return coordinator.pass();
    }

    public IngestCoordinator.State state() {
        return coordinator.state();
    }

    /**
     * Asks the pass to stop. In-flight targets get the configured grace period to finish, then whatever
     * completed is committed and the pass ends as {@code CANCELLED}.
     */
    public void cancel() {
        coordinator.cancel();
    }

    public IngestCoordinator.State await() throws InterruptedException {
        return coordinator.await();
    }

    /**
     * @return true if the pass ended within the timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return coordinator.await(timeout);
    }

    public @Nullable Throwable failure() {
        return coordinator.failure();
    }

    IngestCoordinator coordinator() {
        return coordinator;
    }
}
