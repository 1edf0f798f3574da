package org.lambdabatch.plugin;

import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.io.PatternFormat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Image decoding and diffraction integration used by the batch engine.
 * <p>
 * Implementations are not required to be thread safe: the batch engine calls one instance from a
 * single worker thread at a time.
 */
public interface IntegrationEngine {

    /**
     * Loads the calibration geometry that every later integration uses.
     *
     * @throws IOException If the file cannot be read or parsed.
     */
    void loadCalibration(Path calibrationFile) throws IOException;

    /**
     * Sets the number of radial points of every following 1-D integration.
     */
    void configurePattern(int integrationPoints);

    /**
     * Number of images stored in the file set (the frame count of its first member).
     */
    int imageCount(FileSet fileSet) throws IOException;

    /**
     * Decodes image {@code index}; multi-module sets are composited into one frame.
     */
    ImageFrame loadImage(FileSet fileSet, int index) throws IOException;

    /**
     * Loads the mask file and aligns it to an image of {@code rows x cols} pixels.
     */
    MaskFrame loadMask(Path maskFile, int rows, int cols) throws IOException;

    Pattern integrate1D(ImageFrame image, MaskFrame mask);

    Cake integrate2D(ImageFrame image, MaskFrame mask, int radialPoints, int azimuthBins);

    void savePattern(Pattern pattern, Path target, PatternFormat format) throws IOException;
}
