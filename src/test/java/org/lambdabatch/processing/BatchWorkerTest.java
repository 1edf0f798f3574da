package org.lambdabatch.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lambdabatch.config.ProcessingConfig;
import org.lambdabatch.fake.SyntheticIntegrationEngine;
import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.metrics.Status;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchWorkerTest {

    @TempDir
    Path tempDir;

    @Mock
    BatchListener listener;

    @Test
    @Timeout(10)
    void testSubmit_runsOnWorkerThread() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.1\n");
        Path image = Files.writeString(tempDir.resolve("single.h5"), "data");
        ProcessingConfig config = new ProcessingConfig(calibration, tempDir.resolve("out"), null, 20, 8, List.of("xy"),
                true, true, true, false, false);
        AtomicReference<String> threadName = new AtomicReference<>();
        BatchListener recording = new BatchListener() {
            @Override
            public void onSetComplete(SetStatistics statistics) {
                threadName.set(Thread.currentThread().getName());
            }
        };

        try (BatchWorker worker = new BatchWorker(BatchEngine.create(config, new SyntheticIntegrationEngine(2, 8, 8)))) {
            SetStatistics stats = worker.submit(FileSet.single(image), ExportFlags.of(config), MaskFlags.NONE, recording)
                    .get(5, TimeUnit.SECONDS);

            assertEquals(Status.PASS, stats.status());
            assertEquals(2, stats.totalImages());
            assertTrue(threadName.get().startsWith("BatchWorker-"), threadName.get());
            assertNotEquals(Thread.currentThread().getName(), threadName.get());
        }
    }

    @Test
    @Timeout(10)
    void testSubmit_defectAbortsSetAndReportsError() throws Exception {
        BatchEngine engine = mock(BatchEngine.class);
        FileSet set = FileSet.single(tempDir.resolve("broken.h5"));
        when(engine.processSet(any(), any(), any(), any())).thenThrow(new IllegalStateException("engine crashed"));

        try (BatchWorker worker = new BatchWorker(engine)) {
            SetStatistics stats = worker.submit(set, new ExportFlags(true, true), MaskFlags.NONE, listener).get(5, TimeUnit.SECONDS);

            assertEquals(Status.FAIL, stats.status());
            assertEquals("broken", stats.setName());
            assertEquals(List.of("engine crashed"), stats.errors());
            verify(listener).onError(contains("engine crashed"));
        }
    }

    @Test
    @Timeout(10)
    void testSubmitSelection_returnsRunSummary() throws Exception {
        BatchEngine engine = mock(BatchEngine.class);
        RunSummary summary = new RunSummary(List.of(), List.of("Incomplete multi-module file set"), Duration.ZERO, false);
        when(engine.processSelection(any(), any(), any(), any())).thenReturn(summary);

        try (BatchWorker worker = new BatchWorker(engine)) {
            RunSummary result = worker.submitSelection(List.of(tempDir.resolve("a_m1.nxs")), new ExportFlags(true, false),
                    MaskFlags.NONE, listener).get(5, TimeUnit.SECONDS);

            assertSame(summary, result);
            verify(engine).resetCancellation();
            verify(listener, never()).onError(any());
        }
    }

    @Test
    @Timeout(10)
    void testSubmitSelection_cancelBeforeTaskStartsIsKept() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.1\n");
        Path image = Files.writeString(tempDir.resolve("single.h5"), "data");
        List<Path> modules = List.of(
                Files.writeString(tempDir.resolve("run_m1.nxs"), "m1"),
                Files.writeString(tempDir.resolve("run_m2.nxs"), "m2"),
                Files.writeString(tempDir.resolve("run_m3.nxs"), "m3"));
        ProcessingConfig config = new ProcessingConfig(calibration, tempDir.resolve("out"), null, 20, 8, List.of("xy"),
                true, false, true, false, false);
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BatchListener blocking = new BatchListener() {
            @Override
            public void onProgress(int current, int total, String message) {
                busy.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        try (BatchWorker worker = new BatchWorker(BatchEngine.create(config, new SyntheticIntegrationEngine(3, 8, 8)))) {
            CompletableFuture<SetStatistics> running = worker.submit(FileSet.single(image), ExportFlags.of(config),
                    MaskFlags.NONE, blocking);
            assertTrue(busy.await(5, TimeUnit.SECONDS));
            CompletableFuture<RunSummary> queued = worker.submitSelection(modules, ExportFlags.of(config), MaskFlags.NONE, listener);
            worker.cancel();
            release.countDown();

            assertTrue(running.get(5, TimeUnit.SECONDS).cancelled());
            RunSummary summary = queued.get(5, TimeUnit.SECONDS);
            assertTrue(summary.cancelled());
            assertTrue(summary.fileSets().isEmpty());
            assertFalse(Files.exists(tempDir.resolve("out").resolve("run.xy")));
        }
    }

    @Test
    void testCancel_delegatesToEngine() {
        BatchEngine engine = mock(BatchEngine.class);
        try (BatchWorker worker = new BatchWorker(engine)) {
            worker.cancel();
            verify(engine).cancel();
            assertSame(engine, worker.engine());
        }
    }
}
