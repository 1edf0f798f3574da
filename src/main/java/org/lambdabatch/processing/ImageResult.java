package org.lambdabatch.processing;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one image. A skipped image is also successful; {@code error} is set only on failure.
 */
public record ImageResult(int index, boolean success, boolean skipped, List<Path> patternFiles, List<Path> cakeFiles,
                          String error) {

    public ImageResult {
        patternFiles = List.copyOf(patternFiles);
        cakeFiles = List.copyOf(cakeFiles);
    }

    public static ImageResult skipped(int index, List<Path> patternFiles, List<Path> cakeFiles) {
        return new ImageResult(index, true, true, patternFiles, cakeFiles, null);
    }

    public static ImageResult processed(int index, List<Path> patternFiles, List<Path> cakeFiles) {
        return new ImageResult(index, true, false, patternFiles, cakeFiles, null);
    }

    public static ImageResult failed(int index, String error) {
        return new ImageResult(index, false, false, List.of(), List.of(), error);
    }
}
