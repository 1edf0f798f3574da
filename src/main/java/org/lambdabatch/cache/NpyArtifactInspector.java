package org.lambdabatch.cache;

import org.lambdabatch.io.NpyFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class NpyArtifactInspector implements ArtifactInspector {

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public int[] shape(Path path) throws IOException {
        return NpyFormat.readShape(path);
    }
}
