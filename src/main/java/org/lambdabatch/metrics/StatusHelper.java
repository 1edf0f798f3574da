package org.lambdabatch.metrics;

import org.lambdabatch.processing.ImageResult;
import org.lambdabatch.processing.SetStatistics;

import java.time.Duration;
import java.util.List;

/**
 * Helper methods for creating results for failure cases.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    public static ImageResult createFailedImageResult(int index, Throwable cause) {
        return ImageResult.failed(index, describe(cause));
    }

    /**
     * Statistics of a set that was aborted as a whole, e.g. by a defect escaping the image loop.
     */
    public static SetStatistics createFailedSetStatistics(String setName, Throwable cause) {
        return new SetStatistics(setName, Status.FAIL, 0, 0, 0, 0, List.of(), List.of(),
                List.of(describe(cause)), Duration.ZERO, false);
    }

    public static String describe(Throwable cause) {
        if (cause == null) return "Unknown cause";
        String message = cause.getMessage();
        return (message == null || message.isBlank()) ? cause.getClass().getSimpleName() : message;
    }
}
