package org.lambdabatch.plugin;

/**
 * A 1-D reduced pattern: intensity against the radial axis (two-theta in degrees).
 */
public record Pattern(double[] radial, double[] intensity) {

    public Pattern {
        if (radial.length != intensity.length) {
            throw new IllegalArgumentException("Radial and intensity lengths differ: " + radial.length + " != " + intensity.length);
        }
    }

    public int size() {
        return radial.length;
    }
}
