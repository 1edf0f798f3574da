package org.lambdabatch.metrics;

import org.junit.jupiter.api.Test;
import org.lambdabatch.processing.ImageResult;
import org.lambdabatch.processing.SetStatistics;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusHelperTest {

    @Test
    void testDescribe_fallsBackToExceptionName() {
        assertEquals("disk full", StatusHelper.describe(new IOException("disk full")));
        assertEquals("NullPointerException", StatusHelper.describe(new NullPointerException()));
        assertEquals("Unknown cause", StatusHelper.describe(null));
    }

    @Test
    void testCreateFailedImageResult() {
        ImageResult result = StatusHelper.createFailedImageResult(7, new IllegalStateException("bad frame"));

        assertFalse(result.success());
        assertFalse(result.skipped());
        assertEquals(7, result.index());
        assertEquals("bad frame", result.error());
    }

    @Test
    void testCreateFailedSetStatistics() {
        SetStatistics stats = StatusHelper.createFailedSetStatistics("run", new RuntimeException("crash"));

        assertEquals(Status.FAIL, stats.status());
        assertEquals(0, stats.totalImages());
        assertEquals(List.of("crash"), stats.errors());
    }

    @Test
    void testBuilder_statusRules() {
        Path chi = Path.of("out", "run.chi");
        SetStatistics pass = new SetStatistics.Builder("run").totalImages(2)
                .add(ImageResult.processed(0, List.of(chi), List.of()))
                .add(ImageResult.skipped(1, List.of(chi), List.of()))
                .build(Duration.ofMillis(5));
        assertEquals(Status.PASS, pass.status());
        assertEquals(2, pass.processed());
        assertEquals(1, pass.skipped());
        assertEquals(List.of(chi), pass.patternFiles());

        SetStatistics partial = new SetStatistics.Builder("run").totalImages(2)
                .add(ImageResult.processed(0, List.of(chi), List.of()))
                .add(ImageResult.failed(1, "boom"))
                .build(Duration.ZERO);
        assertEquals(Status.PARTIAL, partial.status());
        assertEquals(List.of("image 1: boom"), partial.errors());

        SetStatistics fail = new SetStatistics.Builder("run").totalImages(1)
                .add(ImageResult.failed(0, "boom"))
                .build(Duration.ZERO);
        assertEquals(Status.FAIL, fail.status());

        SetStatistics cancelled = new SetStatistics.Builder("run").totalImages(3).cancelled().build(Duration.ZERO);
        assertEquals(Status.PARTIAL, cancelled.status());
        assertTrue(cancelled.cancelled());
    }
}
