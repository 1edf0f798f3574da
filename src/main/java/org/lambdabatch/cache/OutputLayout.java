package org.lambdabatch.cache;

import org.lambdabatch.io.PatternFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Output naming for a base name {@code B} under the output directory {@code D}:
 * <ul>
 *     <li>{@code D/B.<ext>} per enabled pattern format</li>
 *     <li>{@code D/B-param/B.int.cake.npy}, {@code B.tth.cake.npy}, {@code B.azi.cake.npy} and a copy of the
 *     calibration file for the 2-D map</li>
 * </ul>
 */
public record OutputLayout(Path outputDir) {

    public static final String CAKE_EXTENSION = "npy";

    public Path patternPath(String baseName, PatternFormat format) {
        return outputDir.resolve(baseName + "." + format.extension());
    }

    public Path cakeFolder(String baseName) {
        return outputDir.resolve(baseName + "-param");
    }

    public Path cakePath(String baseName, ArtifactKind kind) {
        if (!kind.isCake()) throw new IllegalArgumentException("Not a map artifact: " + kind);
        return cakeFolder(baseName).resolve(baseName + "." + kind.fileTag() + ".cake." + CAKE_EXTENSION);
    }

    public Path calibrationCopy(String baseName, Path calibrationFile) {
        return cakeFolder(baseName).resolve(calibrationFile.getFileName());
    }

    public List<ArtifactSpec> patternSpecs(String baseName, List<PatternFormat> formats) {
        final List<ArtifactSpec> specs = new ArrayList<>();
        for (PatternFormat format : formats) specs.add(ArtifactSpec.pattern(patternPath(baseName, format), format));
        return specs;
    }

    /**
     * The three companion files of a 2-D map; the intensity is (azimuthBins, radialPoints).
     */
    public List<ArtifactSpec> cakeSpecs(String baseName, int radialPoints, int azimuthBins) {
        return List.of(
                ArtifactSpec.cakeIntensity(cakePath(baseName, ArtifactKind.CAKE_INTENSITY), azimuthBins, radialPoints),
                ArtifactSpec.cakeRadialAxis(cakePath(baseName, ArtifactKind.CAKE_RADIAL_AXIS), radialPoints),
                ArtifactSpec.cakeAzimuthAxis(cakePath(baseName, ArtifactKind.CAKE_AZIMUTH_AXIS), azimuthBins));
    }
}
