package org.lambdabatch.processing;

import java.time.Duration;
import java.util.List;

public record RunSummary(List<SetStatistics> fileSets, List<String> warnings, Duration duration, boolean cancelled) {

    public RunSummary {
        fileSets = List.copyOf(fileSets);
        warnings = List.copyOf(warnings);
    }

    public int totalImages() {
        return fileSets.stream().mapToInt(SetStatistics::totalImages).sum();
    }

    public int totalProcessed() {
        return fileSets.stream().mapToInt(SetStatistics::processed).sum();
    }

    public int totalSkipped() {
        return fileSets.stream().mapToInt(SetStatistics::skipped).sum();
    }

    public int totalFailed() {
        return fileSets.stream().mapToInt(SetStatistics::failed).sum();
    }
}
