package org.lambdabatch.cache;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Read-only view of existing artifacts.
 */
public interface ArtifactInspector {

    boolean exists(Path path);

    /**
     * Shape of a stored array, read without loading its content.
     */
    int[] shape(Path path) throws IOException;
}
