package org.lambdabatch.processing;

import org.lambdabatch.config.ProcessingConfig;

/**
 * Whether the mask applies to 1-D and 2-D integration, independently.
 */
public record MaskFlags(boolean pattern, boolean cake) {

    public static final MaskFlags NONE = new MaskFlags(false, false);

    public static MaskFlags of(ProcessingConfig config) {
        return new MaskFlags(config.applyMaskToPattern(), config.applyMaskToCake());
    }
}
