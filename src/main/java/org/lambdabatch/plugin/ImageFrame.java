package org.lambdabatch.plugin;

/**
 * One decoded detector image, indexed [row][column].
 */
public record ImageFrame(double[][] pixels) {

    public int rows() {
        return pixels.length;
    }

    public int cols() {
        return pixels.length == 0 ? 0 : pixels[0].length;
    }

    public boolean sameShape(MaskFrame mask) {
        return mask != null && mask.rows() == rows() && mask.cols() == cols();
    }
}
