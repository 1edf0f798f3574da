package org.lambdabatch.fake;

import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.io.PatternFormat;
import org.lambdabatch.plugin.Cake;
import org.lambdabatch.plugin.ImageFrame;
import org.lambdabatch.plugin.IntegrationEngine;
import org.lambdabatch.plugin.MaskFrame;
import org.lambdabatch.plugin.Pattern;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Deterministic stand-in for a diffraction integration library.
 * <p>
 * Every member file is assumed to hold {@code framesPerFile} frames. Frames are synthetic powder
 * rings whose content depends only on the set's base name and the frame index, and multi-module
 * sets are composited side by side. Integration bins pixels by distance from the frame centre
 * (and by azimuth for 2-D maps).
 */
public class SyntheticIntegrationEngine implements IntegrationEngine {

    private static final Logger LOGGER = Logger.getLogger(SyntheticIntegrationEngine.class.getName());
    private static final double DEFAULT_TTH_MAX = 30.0;

    private final int framesPerFile;
    private final int moduleRows;
    private final int moduleCols;
    private int patternPoints = 1000;
    private double tthMax = DEFAULT_TTH_MAX;

    public SyntheticIntegrationEngine() {
        this(4, 64, 64);
    }

    public SyntheticIntegrationEngine(int framesPerFile, int moduleRows, int moduleCols) {
        this.framesPerFile = framesPerFile;
        this.moduleRows = moduleRows;
        this.moduleCols = moduleCols;
    }

    public double tthMax() {
        return tthMax;
    }

    /**
     * Reads a PONI-style {@code key: value} file. When {@code Distance} and {@code PixelSize1} are
     * given, the radial range follows from the detector half diagonal.
     */
    @Override
    public void loadCalibration(Path calibrationFile) throws IOException {
        List<String> lines = Files.readAllLines(calibrationFile);
        Map<String, String> entries = new HashMap<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            int colon = trimmed.indexOf(':');
            if (colon > 0) entries.put(trimmed.substring(0, colon).trim().toLowerCase(Locale.ROOT), trimmed.substring(colon + 1).trim());
        }
        if (entries.isEmpty()) throw new IOException("Calibration file has no entries: " + calibrationFile);
        try {
            if (entries.containsKey("distance") && entries.containsKey("pixelsize1")) {
                double distance = Double.parseDouble(entries.get("distance"));
                double pixel = Double.parseDouble(entries.get("pixelsize1"));
                double halfDiagonal = Math.hypot(moduleRows / 2.0, moduleCols * 1.5) * pixel;
                tthMax = Math.toDegrees(Math.atan2(halfDiagonal, distance));
            }
        } catch (NumberFormatException e) {
            throw new IOException("Bad geometry value in " + calibrationFile + ": " + e.getMessage(), e);
        }
        LOGGER.fine(String.format("Calibration %s: radial range 0..%.3f deg", calibrationFile.getFileName(), tthMax));
    }

    @Override
    public void configurePattern(int integrationPoints) {
        this.patternPoints = integrationPoints;
    }

    @Override
    public int imageCount(FileSet fileSet) throws IOException {
        for (Path p : fileSet.paths()) {
            if (!Files.exists(p)) throw new NoSuchFileException(p.toString());
        }
        return framesPerFile;
    }

    @Override
    public ImageFrame loadImage(FileSet fileSet, int index) throws IOException {
        if (index < 0 || index >= framesPerFile) {
            throw new IOException("Image index " + index + " out of range for " + fileSet.outputName());
        }
        int cols = moduleCols * fileSet.arity();
        double[][] pixels = new double[moduleRows][cols];
        int seed = fileSet.outputName().hashCode() * 31 + index;
        double cr = moduleRows / 2.0;
        double cc = cols / 2.0;
        for (int r = 0; r < moduleRows; r++) {
            for (int c = 0; c < cols; c++) {
                double dist = Math.hypot(r - cr, c - cc);
                double ring = Math.exp(-Math.pow((dist % 12.0) - 6.0, 2) / 2.0);
                double noise = ((r * 7919 + c * 104729 + seed) & 0xFF) / 255.0;
                pixels[r][c] = 100.0 + 1000.0 * ring * (1.0 + 0.1 * index) + noise;
            }
        }
        return new ImageFrame(pixels);
    }

    /**
     * Mask files list excluded pixels as {@code row,col} lines; coordinates outside the image are ignored.
     */
    @Override
    public MaskFrame loadMask(Path maskFile, int rows, int cols) throws IOException {
        boolean[][] masked = new boolean[rows][cols];
        int lineNo = 0;
        for (String line : Files.readAllLines(maskFile)) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            String[] parts = trimmed.split("[,\\s]+");
            if (parts.length != 2) throw new IOException("Bad mask entry at line " + lineNo + ": " + trimmed);
            try {
                int r = Integer.parseInt(parts[0]);
                int c = Integer.parseInt(parts[1]);
                if (r >= 0 && r < rows && c >= 0 && c < cols) masked[r][c] = true;
            } catch (NumberFormatException e) {
                throw new IOException("Bad mask entry at line " + lineNo + ": " + trimmed, e);
            }
        }
        return new MaskFrame(masked);
    }

    @Override
    public Pattern integrate1D(ImageFrame image, MaskFrame mask) {
        int bins = patternPoints;
        double[] sum = new double[bins];
        int[] count = new int[bins];
        double rMax = maxRadius(image);
        forEachPixel(image, mask, (r, c, dist, angle, value) -> {
            int bin = Math.min(bins - 1, (int) (dist / rMax * bins));
            sum[bin] += value;
            count[bin]++;
        });
        double[] radial = new double[bins];
        double[] intensity = new double[bins];
        for (int k = 0; k < bins; k++) {
            radial[k] = (k + 0.5) / bins * tthMax;
            intensity[k] = count[k] == 0 ? 0.0 : sum[k] / count[k];
        }
        return new Pattern(radial, intensity);
    }

    @Override
    public Cake integrate2D(ImageFrame image, MaskFrame mask, int radialPoints, int azimuthBins) {
        double[][] sum = new double[azimuthBins][radialPoints];
        int[][] count = new int[azimuthBins][radialPoints];
        double rMax = maxRadius(image);
        forEachPixel(image, mask, (r, c, dist, angle, value) -> {
            int rb = Math.min(radialPoints - 1, (int) (dist / rMax * radialPoints));
            int ab = Math.min(azimuthBins - 1, (int) ((angle + 180.0) / 360.0 * azimuthBins));
            sum[ab][rb] += value;
            count[ab][rb]++;
        });
        double[][] intensity = new double[azimuthBins][radialPoints];
        for (int a = 0; a < azimuthBins; a++) {
            for (int k = 0; k < radialPoints; k++) {
                intensity[a][k] = count[a][k] == 0 ? 0.0 : sum[a][k] / count[a][k];
            }
        }
        double[] radialAxis = new double[radialPoints];
        for (int k = 0; k < radialPoints; k++) radialAxis[k] = (k + 0.5) / radialPoints * tthMax;
        double[] azimuthAxis = new double[azimuthBins];
        for (int a = 0; a < azimuthBins; a++) azimuthAxis[a] = -180.0 + (a + 0.5) * 360.0 / azimuthBins;
        return new Cake(intensity, radialAxis, azimuthAxis);
    }

    @Override
    public void savePattern(Pattern pattern, Path target, PatternFormat format) throws IOException {
        format.write(pattern, target);
    }

    private static double maxRadius(ImageFrame image) {
        return Math.max(1e-9, Math.hypot(image.rows() / 2.0, image.cols() / 2.0));
    }

    private static void forEachPixel(ImageFrame image, MaskFrame mask, PixelVisitor visitor) {
        double cr = image.rows() / 2.0;
        double cc = image.cols() / 2.0;
        for (int r = 0; r < image.rows(); r++) {
            for (int c = 0; c < image.cols(); c++) {
                if (mask != null && mask.isMasked(r, c)) continue;
                double dist = Math.hypot(r - cr, c - cc);
                double angle = Math.toDegrees(Math.atan2(r - cr, c - cc));
                visitor.visit(r, c, dist, angle, image.pixels()[r][c]);
            }
        }
    }

    @FunctionalInterface
    private interface PixelVisitor {
        void visit(int row, int col, double dist, double angle, double value);
    }
}
