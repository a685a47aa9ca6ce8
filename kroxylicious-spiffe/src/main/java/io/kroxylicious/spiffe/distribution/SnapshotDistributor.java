/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.distribution;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.FastThreadLocal;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseCombiner;

import io.kroxylicious.spiffe.bundle.TrustSnapshot;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Replicates the current {@link TrustSnapshot} into a slot local to each worker thread.
 * <br/>
 * A slot is written only by a task running on its own worker and read only by that worker, so
 * verifications never contend. Snapshots are immutable, so replacing a slot is a single
 * reference swap: a verification that already captured a snapshot keeps using it.
 */
public class SnapshotDistributor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotDistributor.class);

    private final EventExecutor controlExecutor;
    private final EventExecutorGroup workers;
    private final FastThreadLocal<TrustSnapshot> slot = new FastThreadLocal<>();

    // the latest snapshot handed out, as seen by threads that are not workers
    private volatile TrustSnapshot published = TrustSnapshot.empty();

    public SnapshotDistributor(@NonNull EventExecutor controlExecutor, @NonNull EventExecutorGroup workers) {
        this.controlExecutor = Objects.requireNonNull(controlExecutor);
        this.workers = Objects.requireNonNull(workers);
    }

    /**
     * Installs the snapshot on every worker and waits until all of them have applied it.
     *
     * @param snapshot snapshot
     * @throws IllegalStateException if a worker fails to apply it or the caller is interrupted
     */
    public void install(@NonNull TrustSnapshot snapshot) {
        Objects.requireNonNull(snapshot);
        published = snapshot;
        List<Future<?>> pending = new ArrayList<>();
        for (EventExecutor worker : workers) {
            if (worker.inEventLoop()) {
                apply(snapshot);
            }
            else {
                pending.add(worker.submit(() -> apply(snapshot)));
            }
        }
        for (Future<?> future : pending) {
            try {
                future.await();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while installing trust snapshot on workers", e);
            }
            if (!future.isSuccess()) {
                throw new IllegalStateException("Failed to install trust snapshot on a worker", future.cause());
            }
        }
        LOGGER.debug("SPIFFE trust snapshot installed on all workers: {}", snapshot);
    }

    /**
     * Hands the snapshot to the control thread, which broadcasts it to every worker. Returns
     * without waiting.
     *
     * @param snapshot snapshot
     */
    public void installAsync(@NonNull TrustSnapshot snapshot) {
        Objects.requireNonNull(snapshot);
        LOGGER.debug("Posting new SPIFFE trust snapshot to the control thread");
        controlExecutor.execute(() -> {
            published = snapshot;
            LOGGER.debug("Updating SPIFFE trust snapshot for all workers");
            var combiner = new PromiseCombiner(controlExecutor);
            for (EventExecutor worker : workers) {
                combiner.add(worker.submit(() -> apply(snapshot)));
            }
            Promise<Void> allApplied = controlExecutor.newPromise();
            allApplied.addListener(future -> {
                if (future.isSuccess()) {
                    LOGGER.debug("SPIFFE trust snapshot update completed on all workers: {}", snapshot);
                }
                else {
                    LOGGER.warn("SPIFFE trust snapshot update failed on at least one worker", future.cause());
                }
            });
            combiner.finish(allApplied);
        });
    }

    /**
     * Returns the snapshot for the calling thread: the worker's own slot, or for any other
     * thread the most recently installed snapshot.
     *
     * @return snapshot, empty before the first install
     */
    @NonNull
    public TrustSnapshot current() {
        TrustSnapshot local = slot.getIfExists();
        return local != null ? local : published;
    }

    /**
     * Clears the worker slots. Fire and forget.
     */
    public void clear() {
        for (EventExecutor worker : workers) {
            if (!worker.isShuttingDown()) {
                worker.execute(slot::remove);
            }
        }
    }

    private void apply(TrustSnapshot snapshot) {
        LOGGER.debug("Loading new SPIFFE trust snapshot on {}", Thread.currentThread().getName());
        slot.set(snapshot);
    }
}
