package org.lambdabatch.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class FileUtils {

    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    private FileUtils() {
    }

    /**
     * Lists regular files whose full path matches {@code fileFilter}, sorted by path.
     * A missing directory yields an empty list.
     */
    public static List<Path> listFiles(final Path sourceDir, final Pattern fileFilter, final boolean recursive) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            LOGGER.warning(String.format("Dir not found: %s. Empty list.", sourceDir));
            return Collections.emptyList();
        }
        try (Stream<Path> stream = recursive ? Files.walk(sourceDir) : Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> fileFilter == null || fileFilter.matcher(p.toString()).matches())
                    .sorted()
                    .toList();
        }
    }

    /**
     * Copies {@code source} to {@code target} unless the target exists and {@code overwrite} is false.
     *
     * @return true if a copy was made.
     */
    public static boolean copyIfNeeded(final Path source, final Path target, final boolean overwrite) throws IOException {
        if (Files.exists(target) && !overwrite) return false;
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return true;
    }

    /**
     * True when one byte of the file can be read, i.e. the writer released it.
     */
    public static boolean canReadOneByte(final Path path) {
        try (var in = Files.newInputStream(path)) {
            in.read();
            return true;
        } catch (IOException e) {
            LOGGER.fine("Not readable yet: " + path + " (" + e.getMessage() + ")");
            return false;
        }
    }
}
