package org.lambdabatch.config;

import java.nio.file.Path;
import java.time.Duration;

public record WatchConfig(Path watchDir, String filePattern, Long stabilityWindowMillis, Long pollIntervalMillis,
                          Boolean recursive) {

    public static final String DEFAULT_FILE_PATTERN = ".*\\.(nxs|h5)$";

    public WatchConfig {
        filePattern = (filePattern == null || filePattern.isBlank()) ? DEFAULT_FILE_PATTERN : filePattern;
        stabilityWindowMillis = stabilityWindowMillis != null ? stabilityWindowMillis : 2000L;
        pollIntervalMillis = pollIntervalMillis != null ? pollIntervalMillis : 1000L;
        recursive = recursive != null ? recursive : Boolean.TRUE;
    }

    public static WatchConfig defaults() {
        return new WatchConfig(null, null, null, null, null);
    }

    public Duration stabilityWindow() {
        return Duration.ofMillis(stabilityWindowMillis);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }
}
