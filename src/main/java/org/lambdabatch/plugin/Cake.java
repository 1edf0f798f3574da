package org.lambdabatch.plugin;

/**
 * A 2-D re-binned map. {@code intensity} is indexed [azimuth][radial]; the two axis arrays
 * hold the bin centres of each dimension.
 */
public record Cake(double[][] intensity, double[] radialAxis, double[] azimuthAxis) {

    public int azimuthBins() {
        return intensity.length;
    }

    public int radialBins() {
        return intensity.length == 0 ? 0 : intensity[0].length;
    }
}
