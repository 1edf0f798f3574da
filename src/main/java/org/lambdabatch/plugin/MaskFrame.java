package org.lambdabatch.plugin;

/**
 * Pixel mask bound to one image shape. {@code true} marks a pixel excluded from integration.
 */
public record MaskFrame(boolean[][] masked) {

    public int rows() {
        return masked.length;
    }

    public int cols() {
        return masked.length == 0 ? 0 : masked[0].length;
    }

    public boolean isMasked(int row, int col) {
        return masked[row][col];
    }
}
