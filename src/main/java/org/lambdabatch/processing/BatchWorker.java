package org.lambdabatch.processing;

import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.metrics.StatusHelper;
import org.lambdabatch.util.ConcurrencyUtils;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the batch engine on one dedicated thread, off the caller's control thread.
 * Submitted work executes strictly in submission order, one file set at a time.
 */
public class BatchWorker implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(BatchWorker.class.getName());

    private final BatchEngine engine;
    private final ExecutorService executor;

    public BatchWorker(BatchEngine engine) {
        this.engine = Objects.requireNonNull(engine);
        this.executor = Executors.newSingleThreadExecutor(ConcurrencyUtils.createPlatformThreadFactory("BatchWorker-"));
    }

    public BatchEngine engine() {
        return engine;
    }

    public CompletableFuture<SetStatistics> submit(final FileSet fileSet, final ExportFlags exportFlags,
                                                   final MaskFlags maskFlags, final BatchListener listener) {
        return CompletableFuture.supplyAsync(() -> engine.processSet(fileSet, exportFlags, maskFlags, listener), executor)
                .exceptionally(ex -> {
                    Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
                    LOGGER.log(Level.SEVERE, "File set " + fileSet.outputName() + " aborted", cause);
                    listener.onError("File set " + fileSet.outputName() + " aborted: " + StatusHelper.describe(cause));
                    return StatusHelper.createFailedSetStatistics(fileSet.outputName(), cause);
                });
    }

    public CompletableFuture<RunSummary> submitSelection(final Collection<Path> files, final ExportFlags exportFlags,
                                                         final MaskFlags maskFlags, final BatchListener listener) {
        final List<Path> snapshot = List.copyOf(files);
        // cleared here so a cancel issued before the task starts is not lost
        engine.resetCancellation();
        return CompletableFuture.supplyAsync(() -> engine.processSelection(snapshot, exportFlags, maskFlags, listener), executor)
                .whenComplete((summary, ex) -> {
                    if (ex != null) {
                        Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
                        LOGGER.log(Level.SEVERE, "Batch run aborted", cause);
                        listener.onError("Batch run aborted: " + StatusHelper.describe(cause));
                    }
                });
    }

    /** Stops at the next safe point of the running set. */
    public void cancel() {
        engine.cancel();
    }

    @Override
    public void close() {
        ConcurrencyUtils.shutdownExecutorService(executor, "BatchWorker");
    }
}
