package org.lambdabatch.watch;

import org.lambdabatch.cache.ArtifactKind;
import org.lambdabatch.cache.OutputLayout;
import org.lambdabatch.config.WatchConfig;
import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.grouping.FileSetGrouper;
import org.lambdabatch.grouping.GroupingResult;
import org.lambdabatch.grouping.RawFile;
import org.lambdabatch.processing.BatchListener;
import org.lambdabatch.processing.BatchWorker;
import org.lambdabatch.processing.ExportFlags;
import org.lambdabatch.processing.MaskFlags;
import org.lambdabatch.processing.SetStatistics;
import org.lambdabatch.util.ConcurrencyUtils;
import org.lambdabatch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Watch mode: polls the completion detector on a fixed cadence, groups ready files and hands the
 * first complete file set to the batch worker. The next set is dispatched only when the previous
 * one has finished. Files of incomplete groups wait until their missing modules become ready.
 * <p>
 * The pending file list, the detector and the watcher are only touched from the scheduler thread.
 */
public class WatchSession implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WatchSession.class.getName());
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final WatchConfig watchConfig;
    private final BatchWorker worker;
    private final CompletionDetector detector;
    private final DirectoryWatcher watcher;
    private final ExportFlags exportFlags;
    private final MaskFlags maskFlags;
    private final BatchListener listener;
    private final ScheduledExecutorService scheduler;
    private final List<Path> pendingFiles = new ArrayList<>();
    private final AtomicInteger completedSets = new AtomicInteger();

    private boolean pendingChanged;
    private volatile boolean running;
    private volatile CompletableFuture<SetStatistics> inFlight;

    WatchSession(WatchConfig watchConfig, BatchWorker worker, CompletionDetector detector, DirectoryWatcher watcher,
                 ExportFlags exportFlags, MaskFlags maskFlags, BatchListener listener) {
        this.watchConfig = Objects.requireNonNull(watchConfig);
        this.worker = Objects.requireNonNull(worker);
        this.detector = Objects.requireNonNull(detector);
        this.watcher = Objects.requireNonNull(watcher);
        this.exportFlags = exportFlags;
        this.maskFlags = maskFlags;
        this.listener = listener == null ? BatchListener.NONE : listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(ConcurrencyUtils.createPlatformThreadFactory("WatchPoll-"));
    }

    public static WatchSession open(WatchConfig watchConfig, BatchWorker worker, ExportFlags exportFlags,
                                    MaskFlags maskFlags, BatchListener listener) throws IOException {
        Pattern filePattern = Pattern.compile(watchConfig.filePattern());
        DirectoryWatcher watcher = new DirectoryWatcher(watchConfig.watchDir(), filePattern, watchConfig.recursive());
        CompletionDetector detector = new CompletionDetector(watchConfig.stabilityWindow());
        return new WatchSession(watchConfig, worker, detector, watcher, exportFlags, maskFlags, listener);
    }

    public void start() {
        if (running) {
            LOGGER.warning("File watcher already running");
            return;
        }
        running = true;
        worker.engine().resetCancellation();
        scheduler.execute(this::queueExistingFiles);
        long interval = watchConfig.pollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("=== Auto-processing started ===");
    }

    /**
     * Queues files already in the watch directory whose first output is missing.
     */
    private void queueExistingFiles() {
        try {
            Pattern filePattern = Pattern.compile(watchConfig.filePattern());
            List<Path> existing = FileUtils.listFiles(watchConfig.watchDir(), filePattern, watchConfig.recursive());
            int queued = 0;
            for (Path p : existing) {
                if (!isUnprocessed(p)) continue;
                detector.markProcessed(p);
                pendingFiles.add(p);
                queued++;
            }
            if (queued > 0) {
                LOGGER.info(String.format("Found %d existing unprocessed file(s)", queued));
                pendingChanged = true;
                dispatchNext();
            }
        } catch (IOException e) {
            LOGGER.warning("Initial scan of " + watchConfig.watchDir() + " failed: " + e.getMessage());
        }
    }

    private boolean isUnprocessed(Path path) {
        String baseName = RawFile.parse(path).baseName();
        OutputLayout layout = worker.engine().layout();
        Path marker = exportFlags.pattern()
                ? layout.patternPath(baseName, worker.engine().patternFormats().get(0))
                : layout.cakePath(baseName, ArtifactKind.CAKE_INTENSITY);
        return !Files.exists(marker);
    }

    /**
     * One poll cycle: drain filesystem events, collect ready files, dispatch work if the worker is idle.
     */
    private void tick() {
        if (!running) return;
        try {
            watcher.drainEvents(detector);
            List<Path> ready = detector.poll();
            if (!ready.isEmpty()) {
                pendingFiles.addAll(ready);
                pendingChanged = true;
            }
            dispatchNext();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Watch cycle failed", e);
        }
    }

    private void dispatchNext() {
        if (!running || pendingFiles.isEmpty() || !pendingChanged) return;
        CompletableFuture<SetStatistics> current = inFlight;
        if (current != null && !current.isDone()) return;

        GroupingResult grouping = FileSetGrouper.groupPaths(pendingFiles);
        if (grouping.isEmpty()) {
            pendingChanged = false;
            return;
        }
        FileSet fileSet = grouping.fileSets().get(0);
        pendingFiles.removeAll(fileSet.paths());
        LOGGER.info("Starting file set: " + fileSet.outputName());

        CompletableFuture<SetStatistics> submitted = worker.submit(fileSet, exportFlags, maskFlags, listener);
        inFlight = submitted;
        submitted.whenComplete((stats, ex) -> {
            completedSets.incrementAndGet();
            if (!running) return;
            try {
                scheduler.execute(this::dispatchNext);
            } catch (RejectedExecutionException e) {
                LOGGER.fine("Watch scheduler stopped before next dispatch");
            }
        });
    }

    public void stop() {
        if (!running) return;
        running = false;
        worker.cancel();
        ConcurrencyUtils.shutdownExecutorService(scheduler, "WatchScheduler", STOP_TIMEOUT);
        try {
            watcher.close();
        } catch (IOException e) {
            LOGGER.warning("Failed to close file watcher: " + e.getMessage());
        }
        LOGGER.info("=== Auto-processing stopped ===");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int completedSets() {
        return completedSets.get();
    }
}
