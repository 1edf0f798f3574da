package org.lambdabatch.processing;

import org.lambdabatch.config.ProcessingConfig;

/**
 * Which artifact kinds to produce for every image.
 */
public record ExportFlags(boolean pattern, boolean cake) {

    public static ExportFlags of(ProcessingConfig config) {
        return new ExportFlags(config.exportPattern(), config.exportCake());
    }
}
