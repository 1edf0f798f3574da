package org.lambdabatch.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable settings for one run of the batch engine.
 * Absent values fall back to the defaults of the acquisition software.
 */
public record ProcessingConfig(Path calibrationFile, Path outputDir, Path maskFile,
                               Integer integrationPoints, Integer azimuthBins, List<String> patternFormats,
                               Boolean exportPattern, Boolean exportCake,
                               Boolean applyMaskToPattern, Boolean applyMaskToCake, Boolean overwrite) {

    public static final int DEFAULT_INTEGRATION_POINTS = 4857;
    public static final int DEFAULT_AZIMUTH_BINS = 360;
    public static final int MAX_INTEGRATION_POINTS = 1 << 20;
    public static final int MAX_AZIMUTH_BINS = 1 << 16;
    /** Largest 2-D map, in cells, that fits one Java array. */
    public static final long MAX_CAKE_CELLS = Integer.MAX_VALUE - 8;

    public ProcessingConfig {
        integrationPoints = integrationPoints != null ? integrationPoints : DEFAULT_INTEGRATION_POINTS;
        azimuthBins = azimuthBins != null ? azimuthBins : DEFAULT_AZIMUTH_BINS;
        patternFormats = (patternFormats == null || patternFormats.isEmpty()) ? List.of("chi") : List.copyOf(patternFormats);
        exportPattern = exportPattern != null ? exportPattern : Boolean.TRUE;
        exportCake = exportCake != null ? exportCake : Boolean.TRUE;
        applyMaskToPattern = applyMaskToPattern != null ? applyMaskToPattern : Boolean.TRUE;
        applyMaskToCake = applyMaskToCake != null ? applyMaskToCake : Boolean.FALSE;
        overwrite = overwrite != null ? overwrite : Boolean.FALSE;
    }

    /** Radial bins of the 2-D map: twice the 1-D point count. */
    public int radialPoints2D() {
        return 2 * integrationPoints;
    }

    public ProcessingConfig withOverwrite(boolean newOverwrite) {
        return new ProcessingConfig(calibrationFile, outputDir, maskFile, integrationPoints, azimuthBins, patternFormats,
                exportPattern, exportCake, applyMaskToPattern, applyMaskToCake, newOverwrite);
    }

    public ProcessingConfig withResolution(int newIntegrationPoints, int newAzimuthBins) {
        return new ProcessingConfig(calibrationFile, outputDir, maskFile, newIntegrationPoints, newAzimuthBins, patternFormats,
                exportPattern, exportCake, applyMaskToPattern, applyMaskToCake, overwrite);
    }

    public ProcessingConfig withMaskFile(Path newMaskFile) {
        return new ProcessingConfig(calibrationFile, outputDir, newMaskFile, integrationPoints, azimuthBins, patternFormats,
                exportPattern, exportCake, applyMaskToPattern, applyMaskToCake, overwrite);
    }
}
