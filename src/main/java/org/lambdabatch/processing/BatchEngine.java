package org.lambdabatch.processing;

import org.lambdabatch.cache.ArtifactKind;
import org.lambdabatch.cache.ArtifactSpec;
import org.lambdabatch.cache.NpyArtifactInspector;
import org.lambdabatch.cache.OutputCache;
import org.lambdabatch.cache.OutputDecision;
import org.lambdabatch.cache.OutputLayout;
import org.lambdabatch.config.ConfigManager;
import org.lambdabatch.config.ConfigurationException;
import org.lambdabatch.config.ProcessingConfig;
import org.lambdabatch.grouping.FileSet;
import org.lambdabatch.grouping.FileSetGrouper;
import org.lambdabatch.grouping.GroupingResult;
import org.lambdabatch.io.NpyFormat;
import org.lambdabatch.io.PatternFormat;
import org.lambdabatch.metrics.StatusHelper;
import org.lambdabatch.plugin.Cake;
import org.lambdabatch.plugin.ImageFrame;
import org.lambdabatch.plugin.IntegrationEngine;
import org.lambdabatch.plugin.MaskFrame;
import org.lambdabatch.plugin.Pattern;
import org.lambdabatch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the per-set, per-image processing loop.
 * <p>
 * File sets are processed one at a time and images in increasing index order. Before an image is
 * opened the output cache decides which artifacts are still valid; when all of them are, the image
 * is skipped without touching the integration engine. A failing image is recorded and the loop moves
 * on. Instances are confined to a single worker thread, except {@link #cancel()}.
 */
public class BatchEngine {

    private static final Logger LOGGER = Logger.getLogger(BatchEngine.class.getName());

    private final ProcessingConfig config;
    private final List<PatternFormat> patternFormats;
    private final IntegrationEngine engine;
    private final OutputCache cache;
    private final OutputLayout layout;
    private final boolean maskAvailable;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private MaskFrame mask;

    BatchEngine(ProcessingConfig config, List<PatternFormat> patternFormats, IntegrationEngine engine, OutputCache cache) {
        this.config = Objects.requireNonNull(config);
        this.patternFormats = List.copyOf(patternFormats);
        this.engine = Objects.requireNonNull(engine);
        this.cache = Objects.requireNonNull(cache);
        this.layout = new OutputLayout(config.outputDir());
        this.maskAvailable = resolveMask(config.maskFile());
    }

    public static BatchEngine create(ProcessingConfig config, IntegrationEngine engine) throws ConfigurationException {
        return create(config, engine, new OutputCache(new NpyArtifactInspector()));
    }

    /**
     * Validates the configuration, loads the calibration into the engine and prepares the output directory.
     *
     * @throws ConfigurationException If the calibration cannot be loaded or the settings are unusable.
     */
    public static BatchEngine create(ProcessingConfig config, IntegrationEngine engine, OutputCache cache) throws ConfigurationException {
        ConfigManager.validate(config);
        List<PatternFormat> formats = ConfigManager.patternFormats(config);
        try {
            engine.loadCalibration(config.calibrationFile());
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Failed to load calibration " + config.calibrationFile() + ": " + StatusHelper.describe(e), e);
        }
        engine.configurePattern(config.integrationPoints());
        BatchEngine batchEngine = new BatchEngine(config, formats, engine, cache);
        LOGGER.info(String.format("Batch engine ready. Calibration: %s, output: %s, points: %d, azimuth bins: %d",
                config.calibrationFile(), config.outputDir(), config.integrationPoints(), config.azimuthBins()));
        return batchEngine;
    }

    private static boolean resolveMask(Path maskFile) {
        if (maskFile == null) return false;
        if (!Files.exists(maskFile)) {
            LOGGER.warning("Mask file does not exist and will be ignored: " + maskFile);
            return false;
        }
        LOGGER.info("Mask configured: " + maskFile);
        return true;
    }

    public ProcessingConfig config() {
        return config;
    }

    public OutputLayout layout() {
        return layout;
    }

    public List<PatternFormat> patternFormats() {
        return patternFormats;
    }

    /** Requests a stop; it takes effect before the next image or set. */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelled() {
        return cancelRequested.get();
    }

    public void resetCancellation() {
        cancelRequested.set(false);
    }

    public RunSummary processDirectory(Path inputDir, java.util.regex.Pattern fileFilter, boolean recursive,
                                       ExportFlags exportFlags, MaskFlags maskFlags, BatchListener listener) throws IOException {
        List<Path> files = FileUtils.listFiles(inputDir, fileFilter, recursive);
        if (files.isEmpty()) {
            LOGGER.warning("No detector files found in " + inputDir);
        }
        return processSelection(files, exportFlags, maskFlags, listener);
    }

    /**
     * Groups the files and processes every complete set in order. A pending cancel request is honoured
     * before the first set; callers clear stale requests with {@link #resetCancellation()}.
     */
    public RunSummary processSelection(Collection<Path> files, ExportFlags exportFlags, MaskFlags maskFlags, BatchListener listener) {
        final Instant start = Instant.now();
        final GroupingResult grouping = FileSetGrouper.groupPaths(files);
        final List<FileSet> fileSets = grouping.fileSets();
        final List<SetStatistics> results = new ArrayList<>();
        LOGGER.info(String.format("Found %d complete file set(s) in %d file(s)", fileSets.size(), files.size()));

        for (int i = 0; i < fileSets.size(); i++) {
            if (isCancelled()) {
                LOGGER.info(String.format("Run cancelled before file set %d/%d", i + 1, fileSets.size()));
                break;
            }
            LOGGER.info(String.format("Processing file set %d/%d: %s", i + 1, fileSets.size(), fileSets.get(i).outputName()));
            results.add(processSet(fileSets.get(i), exportFlags, maskFlags, listener));
        }
        return new RunSummary(results, grouping.warnings(), Duration.between(start, Instant.now()), isCancelled());
    }

    public SetStatistics processSet(FileSet fileSet, ExportFlags exportFlags, MaskFlags maskFlags) {
        return processSet(fileSet, exportFlags, maskFlags, BatchListener.NONE);
    }

    public SetStatistics processSet(final FileSet fileSet, final ExportFlags exportFlags, final MaskFlags maskFlags,
                                    final BatchListener listener) {
        final Instant start = Instant.now();
        final String baseName = fileSet.outputName();
        final SetStatistics.Builder stats = new SetStatistics.Builder(baseName);

        int imageCount;
        try {
            imageCount = engine.imageCount(fileSet);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Error reading image count of " + fileSet.firstPath() + ": " + StatusHelper.describe(e));
            imageCount = 0;
        }
        stats.totalImages(imageCount);

        if (imageCount == 0) {
            LOGGER.warning("No images found in file set " + baseName);
            return complete(stats, start, listener);
        }

        LOGGER.info(String.format("Processing %d images from %s", imageCount, baseName));
        for (int index = 0; index < imageCount; index++) {
            if (isCancelled()) {
                LOGGER.info(String.format("%s: cancelled after %d/%d images", baseName, index, imageCount));
                stats.cancelled();
                break;
            }
            ImageResult result = processImage(fileSet, index, exportFlags, maskFlags);
            stats.add(result);
            listener.onProgress(index + 1, imageCount, describeProgress(result, index, imageCount));
        }
        return complete(stats, start, listener);
    }

    private SetStatistics complete(SetStatistics.Builder stats, Instant start, BatchListener listener) {
        SetStatistics result = stats.build(Duration.between(start, Instant.now()));
        LOGGER.info(String.format("Completed %s: %d/%d images processed (skipped: %d, failed: %d)",
                result.setName(), result.processed(), result.totalImages(), result.skipped(), result.failed()));
        listener.onSetComplete(result);
        return result;
    }

    private static String describeProgress(ImageResult result, int index, int total) {
        String outcome = !result.success() ? "failed" : result.skipped() ? "skipped" : "processed";
        return String.format("Image %d/%d %s", index + 1, total, outcome);
    }

    List<ArtifactSpec> artifactSpecs(String baseName, ExportFlags exportFlags) {
        final List<ArtifactSpec> specs = new ArrayList<>();
        if (exportFlags.pattern()) specs.addAll(layout.patternSpecs(baseName, patternFormats));
        if (exportFlags.cake()) specs.addAll(layout.cakeSpecs(baseName, config.radialPoints2D(), config.azimuthBins()));
        return specs;
    }

    ImageResult processImage(final FileSet fileSet, final int index, final ExportFlags exportFlags, final MaskFlags maskFlags) {
        final String baseName = fileSet.outputName();
        final List<ArtifactSpec> specs = artifactSpecs(baseName, exportFlags);
        final Map<ArtifactSpec, OutputDecision> decisions = cache.decide(specs, config.overwrite());

        final List<Path> patternFiles = new ArrayList<>();
        final List<Path> cakeFiles = new ArrayList<>();
        for (ArtifactSpec spec : specs) {
            (spec.kind().isCake() ? cakeFiles : patternFiles).add(spec.target());
        }

        if (specs.isEmpty() || OutputCache.allSkip(decisions)) {
            LOGGER.info(String.format("Skipping image %d of %s: outputs already exist", index, baseName));
            return ImageResult.skipped(index, patternFiles, cakeFiles);
        }

        try {
            final ImageFrame image = engine.loadImage(fileSet, index);
            if (image == null) throw new ProcessingException("Engine returned no image for index " + index);

            final List<ArtifactSpec> patternWork = pending(specs, decisions, false);
            final List<ArtifactSpec> cakeWork = pending(specs, decisions, true);
            final boolean maskPattern = maskAvailable && maskFlags.pattern() && !patternWork.isEmpty();
            final boolean maskCake = maskAvailable && maskFlags.cake() && !cakeWork.isEmpty();
            if (maskPattern || maskCake) ensureMaskFor(image);

            if (!patternWork.isEmpty()) {
                Pattern pattern = engine.integrate1D(image, maskPattern ? mask : null);
                if (pattern == null) throw new ProcessingException("Engine returned no pattern for index " + index);
                for (ArtifactSpec spec : patternWork) {
                    engine.savePattern(pattern, spec.target(), spec.format());
                    LOGGER.fine("Saved pattern: " + spec.target().getFileName());
                }
            } else if (exportFlags.pattern()) {
                LOGGER.info(String.format("Skipping existing pattern file(s) for %s", baseName));
            }

            if (!cakeWork.isEmpty()) {
                Cake cake = engine.integrate2D(image, maskCake ? mask : null, config.radialPoints2D(), config.azimuthBins());
                writeCake(baseName, cake, cakeWork);
            }
            return ImageResult.processed(index, patternFiles, cakeFiles);

        } catch (ProcessingException | IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, String.format("Error processing image %d of %s: %s", index, baseName, StatusHelper.describe(e)));
            return StatusHelper.createFailedImageResult(index, e);
        }
    }

    private static List<ArtifactSpec> pending(List<ArtifactSpec> specs, Map<ArtifactSpec, OutputDecision> decisions, boolean cake) {
        return specs.stream()
                .filter(s -> s.kind().isCake() == cake)
                .filter(s -> decisions.get(s).needsRegeneration())
                .toList();
    }

    /**
     * Masks are bound to an image shape, so a differently shaped image forces a reload.
     */
    private void ensureMaskFor(ImageFrame image) throws IOException {
        if (image.sameShape(mask)) return;
        mask = engine.loadMask(config.maskFile(), image.rows(), image.cols());
        if (!image.sameShape(mask)) {
            throw new IOException(String.format("Mask %s could not be aligned to image shape (%d, %d)",
                    config.maskFile(), image.rows(), image.cols()));
        }
        LOGGER.info(String.format("Mask loaded for image shape (%d, %d): %s", image.rows(), image.cols(), config.maskFile()));
    }

    private void writeCake(String baseName, Cake cake, List<ArtifactSpec> cakeWork) throws ProcessingException, IOException {
        if (cake == null) throw new ProcessingException("Engine returned no 2-D map for " + baseName);
        for (ArtifactSpec spec : cakeWork) {
            int[] actual = switch (spec.kind()) {
                case CAKE_INTENSITY -> new int[]{cake.azimuthBins(), cake.radialBins()};
                case CAKE_RADIAL_AXIS -> new int[]{cake.radialAxis().length};
                case CAKE_AZIMUTH_AXIS -> new int[]{cake.azimuthAxis().length};
                default -> throw new IllegalStateException("Not a map artifact: " + spec.kind());
            };
            if (!spec.shapeMatches(actual)) {
                throw new ProcessingException(String.format("Engine produced %s of shape %s, expected %s",
                        spec.kind(), Arrays.toString(actual), spec.expectedShape()));
            }
        }

        Path folder = layout.cakeFolder(baseName);
        Files.createDirectories(folder);
        copyCalibration(baseName);
        for (ArtifactSpec spec : cakeWork) {
            if (spec.kind() == ArtifactKind.CAKE_INTENSITY) NpyFormat.write(spec.target(), cake.intensity());
            else if (spec.kind() == ArtifactKind.CAKE_RADIAL_AXIS) NpyFormat.write(spec.target(), cake.radialAxis());
            else NpyFormat.write(spec.target(), cake.azimuthAxis());
        }
        LOGGER.fine(String.format("Saved map files in %s", folder.getFileName()));
    }

    private void copyCalibration(String baseName) {
        Path target = layout.calibrationCopy(baseName, config.calibrationFile());
        try {
            if (FileUtils.copyIfNeeded(config.calibrationFile(), target, config.overwrite())) {
                LOGGER.fine("Copied calibration file to " + target.getParent());
            }
        } catch (IOException e) {
            LOGGER.warning("Failed to copy calibration file: " + e.getMessage());
        }
    }
}
