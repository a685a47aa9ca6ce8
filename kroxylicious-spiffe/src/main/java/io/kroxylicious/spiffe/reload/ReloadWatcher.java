/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kroxylicious.spiffe.reload;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Watches a single file and invokes a callback each time it is modified or (re)created.
 * The parent directory is watched, so replacing the file with an atomic move is seen too.
 * The callback runs on the watcher's own thread and should hand the work off quickly.
 */
public class ReloadWatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReloadWatcher.class);

    static final String THREAD_NAME = "spiffe-bundle-watcher";

    private final Path watchedFile;
    private final Runnable onChange;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService watcherExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, THREAD_NAME);
        t.setDaemon(true);
        return t;
    });

    private WatchService watchService;
    private WatchKey watchKey;

    /**
     * Creates a watcher. Nothing is watched until {@link #start()}.
     *
     * @param watchedFile the file to watch
     * @param onChange invoked after every change to the file
     */
    public ReloadWatcher(@NonNull Path watchedFile, @NonNull Runnable onChange) {
        this.watchedFile = watchedFile.toAbsolutePath();
        this.onChange = Objects.requireNonNull(onChange);
        if (this.watchedFile.getParent() == null) {
            throw new IllegalArgumentException("Watched file must have a parent directory: " + this.watchedFile);
        }
    }

    /**
     * Registers the watch and starts consuming events. Registration is complete when this
     * method returns, so any later change to the file is reported.
     *
     * @throws UncheckedIOException if the watch cannot be registered
     */
    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        Path parentDir = watchedFile.getParent();
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
            this.watchKey = parentDir.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_CREATE);
        }
        catch (IOException e) {
            running.set(false);
            closeWatchService();
            watcherExecutor.shutdown();
            throw new UncheckedIOException("Failed to watch directory " + parentDir + " for changes to " + watchedFile.getFileName(), e);
        }
        watcherExecutor.execute(this::watchForChanges);
        LOGGER.info("Started watching file: {}", watchedFile);
    }

    /**
     * Stops watching. The callback is not invoked for changes after this returns, although one
     * invocation already in progress may still complete.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (watchKey != null) {
            watchKey.cancel();
        }
        closeWatchService();
        watcherExecutor.shutdown();
        try {
            if (!watcherExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                watcherExecutor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            watcherExecutor.shutdownNow();
        }
        LOGGER.info("Stopped watching file: {}", watchedFile);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void closeWatchService() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        }
        catch (IOException e) {
            LOGGER.warn("Error closing watch service for {}", watchedFile, e);
        }
    }

    private void watchForChanges() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            }
            catch (ClosedWatchServiceException e) {
                LOGGER.debug("Watch service for {} closed", watchedFile);
                break;
            }
            catch (InterruptedException e) {
                LOGGER.debug("Watcher for {} interrupted", watchedFile);
                Thread.currentThread().interrupt();
                break;
            }

            if (key != watchKey) {
                continue;
            }

            boolean fileChanged = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == StandardWatchEventKinds.OVERFLOW) {
                    LOGGER.warn("Watch event overflow for {}: some events may have been lost", watchedFile);
                    // the file may be among the lost events
                    fileChanged = true;
                    continue;
                }
                if (watchedFile.getFileName().equals(event.context())) {
                    LOGGER.debug("Watched file {} changed: {}", watchedFile, kind);
                    fileChanged = true;
                }
            }

            if (!key.reset()) {
                LOGGER.warn("Watch key for {} is no longer valid - stopping watcher", watchedFile);
                running.set(false);
                break;
            }

            if (fileChanged && running.get()) {
                notifyChange();
            }
        }
    }

    private void notifyChange() {
        try {
            onChange.run();
        }
        catch (RuntimeException e) {
            LOGGER.error("Error handling change to {}", watchedFile, e);
        }
    }
}
