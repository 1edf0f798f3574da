package org.lambdabatch.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    private static final Pattern DETECTOR_FILES = Pattern.compile(".*\\.(nxs|h5)$");

    @TempDir
    Path tempDir;

    @Test
    void testListFiles_filtersAndSorts() throws IOException {
        Files.writeString(tempDir.resolve("b_m1.nxs"), "");
        Files.writeString(tempDir.resolve("a.h5"), "");
        Files.writeString(tempDir.resolve("readme.txt"), "");
        Files.createDirectory(tempDir.resolve("dir.nxs"));

        List<Path> files = FileUtils.listFiles(tempDir, DETECTOR_FILES, false);

        assertEquals(List.of(tempDir.resolve("a.h5"), tempDir.resolve("b_m1.nxs")), files);
    }

    @Test
    void testListFiles_recursiveDescendsIntoSubdirectories() throws IOException {
        Path sub = Files.createDirectories(tempDir.resolve("day1").resolve("scan"));
        Files.writeString(sub.resolve("deep.nxs"), "");
        Files.writeString(tempDir.resolve("top.nxs"), "");

        assertEquals(1, FileUtils.listFiles(tempDir, DETECTOR_FILES, false).size());
        assertEquals(2, FileUtils.listFiles(tempDir, DETECTOR_FILES, true).size());
        assertEquals(2, FileUtils.listFiles(tempDir, null, true).size());
    }

    @Test
    void testListFiles_missingDirectoryIsEmpty() throws IOException {
        assertTrue(FileUtils.listFiles(tempDir.resolve("absent"), DETECTOR_FILES, true).isEmpty());
    }

    @Test
    void testCopyIfNeeded_respectsOverwrite() throws IOException {
        Path source = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");
        Path target = tempDir.resolve("run-param").resolve("cal.poni");

        assertTrue(FileUtils.copyIfNeeded(source, target, false));
        assertEquals("Distance: 0.2\n", Files.readString(target));

        Files.writeString(source, "Distance: 0.3\n");
        assertFalse(FileUtils.copyIfNeeded(source, target, false));
        assertEquals("Distance: 0.2\n", Files.readString(target));

        assertTrue(FileUtils.copyIfNeeded(source, target, true));
        assertEquals("Distance: 0.3\n", Files.readString(target));
    }

    @Test
    void testCanReadOneByte() throws IOException {
        Path file = Files.writeString(tempDir.resolve("run.h5"), "x");

        assertTrue(FileUtils.canReadOneByte(file));
        assertFalse(FileUtils.canReadOneByte(tempDir.resolve("missing.h5")));
    }
}
