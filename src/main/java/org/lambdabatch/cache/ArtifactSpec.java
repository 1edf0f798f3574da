package org.lambdabatch.cache;

import org.lambdabatch.io.PatternFormat;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One desired output file. Pattern artifacts carry their text format; map companions carry the
 * shape the file must have to be reused.
 */
public record ArtifactSpec(ArtifactKind kind, Path target, PatternFormat format, List<Integer> expectedShape) {

    public ArtifactSpec {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        expectedShape = expectedShape == null ? List.of() : List.copyOf(expectedShape);
        if (kind == ArtifactKind.PATTERN_1D && format == null) {
            throw new IllegalArgumentException("Pattern artifact needs a format: " + target);
        }
        if (kind.isCake() && expectedShape.isEmpty()) {
            throw new IllegalArgumentException("Map artifact needs an expected shape: " + target);
        }
    }

    public static ArtifactSpec pattern(Path target, PatternFormat format) {
        return new ArtifactSpec(ArtifactKind.PATTERN_1D, target, format, List.of());
    }

    public static ArtifactSpec cakeIntensity(Path target, int azimuthBins, int radialPoints) {
        return new ArtifactSpec(ArtifactKind.CAKE_INTENSITY, target, null, List.of(azimuthBins, radialPoints));
    }

    public static ArtifactSpec cakeRadialAxis(Path target, int radialPoints) {
        return new ArtifactSpec(ArtifactKind.CAKE_RADIAL_AXIS, target, null, List.of(radialPoints));
    }

    public static ArtifactSpec cakeAzimuthAxis(Path target, int azimuthBins) {
        return new ArtifactSpec(ArtifactKind.CAKE_AZIMUTH_AXIS, target, null, List.of(azimuthBins));
    }

    public boolean shapeMatches(int[] actual) {
        if (actual == null || actual.length != expectedShape.size()) return false;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != expectedShape.get(i)) return false;
        }
        return true;
    }
}
