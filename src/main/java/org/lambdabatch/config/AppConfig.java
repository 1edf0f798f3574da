package org.lambdabatch.config;

import java.nio.file.Path;
import java.util.List;

public record AppConfig(String mode, Path inputDir, List<Path> inputFiles, String integrationEngine,
                        ProcessingConfig processing, WatchConfig watch) {

    public static final String MODE_BATCH = "batch";
    public static final String MODE_WATCH = "watch";
    public static final String DEFAULT_ENGINE = "org.lambdabatch.fake.SyntheticIntegrationEngine";

    public AppConfig {
        mode = (mode == null || mode.isBlank()) ? MODE_BATCH : mode.trim().toLowerCase();
        inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        integrationEngine = (integrationEngine == null || integrationEngine.isBlank()) ? DEFAULT_ENGINE : integrationEngine;
        watch = watch == null ? WatchConfig.defaults() : watch;
    }

    public boolean watchMode() {
        return MODE_WATCH.equals(mode);
    }
}
