package org.lambdabatch;

import org.lambdabatch.config.AppConfig;
import org.lambdabatch.config.ConfigManager;
import org.lambdabatch.config.ConfigurationException;
import org.lambdabatch.config.ProcessingConfig;
import org.lambdabatch.plugin.IntegrationEngine;
import org.lambdabatch.processing.BatchEngine;
import org.lambdabatch.processing.BatchListener;
import org.lambdabatch.processing.BatchWorker;
import org.lambdabatch.processing.ExportFlags;
import org.lambdabatch.processing.MaskFlags;
import org.lambdabatch.processing.RunSummary;
import org.lambdabatch.processing.SetStatistics;
import org.lambdabatch.util.FileUtils;
import org.lambdabatch.watch.WatchSession;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Command line entry point. Integrates a batch of detector files, or keeps watching a directory
 * and integrates acquisitions as they complete.
 * <p>
 * Usage: {@code lambda-batch [--config path/to/config.yaml]}
 */
public class LambdaBatch {

    private static final Logger LOGGER = Logger.getLogger(LambdaBatch.class.getName());
    static final String LOCK_FILE = ".lambda-batch.lock";
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_LOCKED = 3;
    private static final long STOP_GRACE_SECONDS = 60;

    private final AppConfig appConfig;

    public LambdaBatch(final AppConfig appConfig) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
    }

    public static void main(final String[] args) {
        int status = execute(args);
        if (status != EXIT_OK) System.exit(status);
    }

    static int execute(final String[] args) {
        final AppConfig appConfig;
        final BatchEngine engine;
        try {
            appConfig = loadConfig(args);
            ConfigManager.validate(appConfig);
            engine = BatchEngine.create(appConfig.processing(), instantiateEngine(appConfig.integrationEngine()));
        } catch (final ConfigurationException e) {
            System.err.println("!!! Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        Path lockFilePath = appConfig.processing().outputDir().resolve(LOCK_FILE);
        try (RandomAccessFile raf = new RandomAccessFile(lockFilePath.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = channel.tryLock()) {
            if (lock == null) {
                System.err.printf("!!!! WARN: Could not acquire lock (%s), another instance already running ??? %n", lockFilePath);
                return EXIT_LOCKED;
            }
            new LambdaBatch(appConfig).run(engine);
            return EXIT_OK;
        } catch (final IOException e) {
            System.err.println("\n>>> I/O error: " + e.getMessage());
            e.printStackTrace();
            return EXIT_RUN_FAILED;
        } catch (final InterruptedException e) {
            System.err.println("\n>>> Main execution thread interrupted.");
            Thread.currentThread().interrupt();
            return EXIT_RUN_FAILED;
        }
    }

    static AppConfig loadConfig(final String[] args) throws ConfigurationException {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) throw new ConfigurationException("--config needs a file argument");
                return ConfigManager.load(Path.of(args[i + 1]));
            }
        }
        return ConfigManager.getConfig();
    }

    /**
     * Creates the configured integration engine through its public no-argument constructor.
     */
    static IntegrationEngine instantiateEngine(final String className) throws ConfigurationException {
        try {
            Class<?> type = Class.forName(className);
            if (!IntegrationEngine.class.isAssignableFrom(type)) {
                throw new ConfigurationException(className + " does not implement " + IntegrationEngine.class.getSimpleName());
            }
            return (IntegrationEngine) type.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new ConfigurationException("Cannot instantiate integration engine " + className + ": " + e, e);
        }
    }

    void run(final BatchEngine engine) throws IOException, InterruptedException {
        final ProcessingConfig processing = appConfig.processing();
        final ExportFlags exportFlags = ExportFlags.of(processing);
        final MaskFlags maskFlags = MaskFlags.of(processing);
        final BatchListener listener = new ConsoleListener();

        try (BatchWorker worker = new BatchWorker(engine)) {
            if (appConfig.watchMode()) {
                runWatch(worker, exportFlags, maskFlags, listener);
            } else {
                runBatch(worker, exportFlags, maskFlags, listener);
            }
        }
    }

    private void runBatch(final BatchWorker worker, final ExportFlags exportFlags,
                          final MaskFlags maskFlags, final BatchListener listener) throws IOException, InterruptedException {
        System.out.println("========================================================");
        System.out.println(" Starting batch integration ");
        System.out.println("========================================================");

        List<Path> files = appConfig.inputFiles();
        if (files.isEmpty()) {
            Pattern filter = Pattern.compile(appConfig.watch().filePattern());
            files = FileUtils.listFiles(appConfig.inputDir(), filter, appConfig.watch().recursive());
            if (files.isEmpty()) LOGGER.warning("No detector files found in " + appConfig.inputDir());
        }
        final CountDownLatch reported = new CountDownLatch(1);
        final CompletableFuture<RunSummary> run = worker.submitSelection(files, exportFlags, maskFlags, listener);
        Runtime.getRuntime().addShutdownHook(batchStopHook(worker, reported));
        try {
            final RunSummary summary = await(run);
            System.out.println("\n\n========================================================");
            System.out.println(summary.cancelled() ? " Batch Cancelled " : " Batch Finished ");
            System.out.println("========================================================");
            printSummary(summary);
        } finally {
            reported.countDown();
        }
    }

    /**
     * Builds the hook run on Ctrl+C during a batch: the worker stops after the current image and the
     * hook holds the JVM open until the summary has been printed.
     */
    static Thread batchStopHook(final BatchWorker worker, final CountDownLatch reported) {
        return new Thread(() -> {
            if (reported.getCount() == 0) return;
            System.out.println("\n>>> Stop requested, finishing the current image...");
            worker.cancel();
            try {
                if (!reported.await(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    LOGGER.warning("Batch did not stop within " + STOP_GRACE_SECONDS + " s, exiting anyway");
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "BatchShutdown");
    }

    private static RunSummary await(CompletableFuture<RunSummary> future) throws InterruptedException, IOException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            throw new IOException("Batch run failed: " + e.getCause(), e.getCause());
        }
    }

    private void runWatch(final BatchWorker worker, final ExportFlags exportFlags, final MaskFlags maskFlags,
                          final BatchListener listener) throws IOException, InterruptedException {
        final CountDownLatch stopped = new CountDownLatch(1);
        final WatchSession session = WatchSession.open(appConfig.watch(), worker, exportFlags, maskFlags, listener);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            session.stop();
            stopped.countDown();
        }, "WatchShutdown"));

        System.out.println("========================================================");
        System.out.printf(" Watching %s for completed acquisitions (Ctrl+C to stop) %n", appConfig.watch().watchDir());
        System.out.println("========================================================");
        session.start();
        stopped.await();
        System.out.printf("Watch stopped after %d file set(s).%n", session.completedSets());
    }

    static void printSummary(final RunSummary summary) {
        System.out.println("Total Execution Time: " + summary.duration().toMillis() + " ms");
        System.out.println("---------------------- RUN SUMMARY ----------------------");
        for (final SetStatistics stats : summary.fileSets()) {
            String cancelled = stats.cancelled() ? "[CANCELLED]" : "";
            System.out.printf("File set: %-30s | Status: %-7s | Duration: %6dms | Images: %4d | Processed: %4d | Skipped: %4d | Failed: %4d %s%n",
                    stats.setName(), stats.status(), stats.duration().toMillis(), stats.totalImages(),
                    stats.processed(), stats.skipped(), stats.failed(), cancelled);
            for (final String error : stats.errors()) {
                System.out.println("    " + error);
            }
        }
        if (!summary.warnings().isEmpty()) {
            System.out.println("  ----------------------------------------------------");
            summary.warnings().forEach(w -> System.out.println("  WARN: " + w));
        }
        System.out.println("----------------------------------------------------------");
        System.out.printf("Total: %d images, %d processed, %d skipped, %d failed%s%n",
                summary.totalImages(), summary.totalProcessed(), summary.totalSkipped(), summary.totalFailed(),
                summary.cancelled() ? " (cancelled)" : "");
    }

    /** Prints progress lines the way an operator console would. */
    static final class ConsoleListener implements BatchListener {

        @Override
        public void onProgress(int current, int total, String message) {
            System.out.printf("  [%d/%d] %s%n", current, total, message);
        }

        @Override
        public void onSetComplete(SetStatistics statistics) {
            System.out.printf("File set %s finished: %s (%d/%d processed)%n", statistics.setName(), statistics.status(),
                    statistics.processed(), statistics.totalImages());
        }

        @Override
        public void onError(String message) {
            LOGGER.severe(message);
        }
    }
}
