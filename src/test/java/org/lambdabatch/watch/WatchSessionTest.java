package org.lambdabatch.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lambdabatch.config.ProcessingConfig;
import org.lambdabatch.config.WatchConfig;
import org.lambdabatch.fake.SyntheticIntegrationEngine;
import org.lambdabatch.processing.BatchEngine;
import org.lambdabatch.processing.BatchListener;
import org.lambdabatch.processing.BatchWorker;
import org.lambdabatch.processing.ExportFlags;
import org.lambdabatch.processing.MaskFlags;
import org.lambdabatch.processing.SetStatistics;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchSessionTest {

    private static final long WINDOW_MS = 50;
    private static final long POLL_MS = 20;

    @TempDir
    Path tempDir;

    @Mock
    DirectoryWatcher watcher;

    private final Queue<Path> events = new ConcurrentLinkedQueue<>();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private Path watchDir;
    private Path outputDir;
    private BatchWorker worker;
    private WatchSession session;

    @BeforeEach
    void setUp() throws Exception {
        watchDir = Files.createDirectories(tempDir.resolve("incoming"));
        outputDir = tempDir.resolve("processed");
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");
        ProcessingConfig config = new ProcessingConfig(calibration, outputDir, null, 20, 8, List.of("chi"),
                true, true, true, false, false);
        worker = new BatchWorker(BatchEngine.create(config, new SyntheticIntegrationEngine(2, 8, 8)));

        lenient().when(watcher.drainEvents(any())).thenAnswer(inv -> {
            CompletionDetector detector = inv.getArgument(0);
            int n = 0;
            Path p;
            while ((p = events.poll()) != null) {
                detector.recordEvent(p);
                n++;
            }
            return n;
        });

        WatchConfig watchConfig = new WatchConfig(watchDir, null, WINDOW_MS, POLL_MS, true);
        BatchListener listener = new BatchListener() {
            @Override
            public void onSetComplete(SetStatistics statistics) {
                completed.add(statistics.setName());
            }
        };
        session = new WatchSession(watchConfig, worker, new CompletionDetector(Duration.ofMillis(WINDOW_MS)), watcher,
                new ExportFlags(true, true), MaskFlags.NONE, listener);
    }

    @AfterEach
    void tearDown() {
        session.stop();
        worker.close();
    }

    private Path arrive(String name) throws IOException {
        Path p = Files.writeString(watchDir.resolve(name), "frames of " + name);
        events.add(p);
        return p;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        while (!condition.getAsBoolean()) Thread.sleep(10);
    }

    @Test
    @Timeout(10)
    void testStart_queuesExistingUnprocessedFiles() throws Exception {
        for (int m = 1; m <= 3; m++) Files.writeString(watchDir.resolve("run_m" + m + ".nxs"), "m" + m);
        Files.writeString(watchDir.resolve("done.h5"), "already reduced");
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("done.chi"), "existing pattern");

        session.start();
        await(() -> completed.size() == 1);
        Thread.sleep(5 * POLL_MS);

        assertEquals(List.of("run"), completed);
        assertTrue(Files.exists(outputDir.resolve("run.chi")));
    }

    @Test
    @Timeout(10)
    void testTick_incompleteGroupWaitsForMissingModule() throws Exception {
        session.start();
        arrive("scan_m1.nxs");
        arrive("scan_m2.nxs");
        Thread.sleep(WINDOW_MS + 10 * POLL_MS);
        assertTrue(completed.isEmpty());

        arrive("scan_m3.nxs");
        await(() -> completed.size() == 1);

        await(() -> session.completedSets() == 1);
        assertEquals(List.of("scan"), completed);
    }

    @Test
    @Timeout(10)
    void testStart_setsProcessedOneAfterAnotherInOrder() throws Exception {
        for (String name : List.of("c.h5", "a.h5", "b.h5")) Files.writeString(watchDir.resolve(name), name);

        session.start();
        await(() -> completed.size() == 3);

        await(() -> session.completedSets() == 3);
        assertEquals(List.of("a", "b", "c"), completed);
    }

    @Test
    @Timeout(10)
    void testTick_fileReportedOnlyOnce() throws Exception {
        session.start();
        Path file = arrive("single.h5");
        await(() -> completed.size() == 1);

        events.add(file);
        Thread.sleep(WINDOW_MS + 10 * POLL_MS);

        assertEquals(1, completed.size());
    }

    @Test
    void testStop_cancelsWorkerAndClosesWatcher() throws Exception {
        session.start();
        assertTrue(session.isRunning());

        session.stop();

        assertFalse(session.isRunning());
        assertTrue(worker.engine().isCancelled());
        verify(watcher).close();
    }
}
