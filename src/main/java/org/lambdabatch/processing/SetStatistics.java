package org.lambdabatch.processing;

import org.lambdabatch.metrics.Status;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate over one file set. {@code processed} counts every successful image, skipped ones included.
 * Output paths are listed once each, in the order they were first produced.
 */
public record SetStatistics(String setName, Status status, int totalImages, int processed, int skipped, int failed,
                            List<Path> patternFiles, List<Path> cakeFiles, List<String> errors, Duration duration,
                            boolean cancelled) {

    public SetStatistics {
        patternFiles = List.copyOf(patternFiles);
        cakeFiles = List.copyOf(cakeFiles);
        errors = List.copyOf(errors);
    }

    /**
     * Folds image results into statistics.
     */
    public static final class Builder {
        private final String setName;
        private int totalImages;
        private int processed;
        private int skipped;
        private int failed;
        private boolean cancelled;
        private final Set<Path> patternFiles = new LinkedHashSet<>();
        private final Set<Path> cakeFiles = new LinkedHashSet<>();
        private final List<String> errors = new ArrayList<>();

        public Builder(String setName) {
            this.setName = setName;
        }

        public Builder totalImages(int total) {
            this.totalImages = total;
            return this;
        }

        public Builder cancelled() {
            this.cancelled = true;
            return this;
        }

        public Builder add(ImageResult result) {
            if (result.success()) {
                processed++;
                if (result.skipped()) skipped++;
                patternFiles.addAll(result.patternFiles());
                cakeFiles.addAll(result.cakeFiles());
            } else {
                failed++;
                errors.add("image " + result.index() + ": " + result.error());
            }
            return this;
        }

        public SetStatistics build(Duration duration) {
            Status status;
            if (failed == 0 && !cancelled) status = Status.PASS;
            else if (processed > 0) status = Status.PARTIAL;
            else status = cancelled ? Status.PARTIAL : Status.FAIL;
            return new SetStatistics(setName, status, totalImages, processed, skipped, failed,
                    List.copyOf(patternFiles), List.copyOf(cakeFiles), errors, duration, cancelled);
        }
    }
}
