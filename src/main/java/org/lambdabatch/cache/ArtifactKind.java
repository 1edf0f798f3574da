package org.lambdabatch.cache;

public enum ArtifactKind {
    PATTERN_1D("pattern", null),
    CAKE_INTENSITY("cake intensity", "int"),
    /** Radial (two-theta) axis of the 2-D map. */
    CAKE_RADIAL_AXIS("cake radial axis", "tth"),
    /** Azimuth axis of the 2-D map. */
    CAKE_AZIMUTH_AXIS("cake azimuth axis", "azi");

    private final String label;
    private final String fileTag;

    ArtifactKind(String label, String fileTag) {
        this.label = label;
        this.fileTag = fileTag;
    }

    public boolean isCake() {
        return this != PATTERN_1D;
    }

    /** Infix of the companion file name, e.g. {@code int} in {@code B.int.cake.npy}. */
    public String fileTag() {
        return fileTag;
    }

    @Override
    public String toString() {
        return label;
    }
}
