package org.lambdabatch.watch;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Adapts a {@link WatchService} to the completion detector. Events are buffered by the
 * watch service and only handed over when {@link #drainEvents(CompletionDetector)} is called
 * from the polling thread.
 */
public class DirectoryWatcher implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(DirectoryWatcher.class.getName());

    private final Path root;
    private final Pattern filePattern;
    private final boolean recursive;
    private final WatchService watchService;
    private final Map<WatchKey, Path> keys = new HashMap<>();

    public DirectoryWatcher(Path root, Pattern filePattern, boolean recursive) throws IOException {
        if (!Files.isDirectory(root)) throw new IOException("Watch directory does not exist: " + root);
        this.root = root;
        this.filePattern = filePattern;
        this.recursive = recursive;
        this.watchService = root.getFileSystem().newWatchService();
        register(root);
        LOGGER.info("Starting file watcher on: " + root + (recursive ? " (recursive)" : ""));
    }

    public Path root() {
        return root;
    }

    public boolean matches(Path path) {
        return filePattern.matcher(path.toString()).matches();
    }

    private void register(Path dir) throws IOException {
        if (recursive) {
            try (Stream<Path> dirs = Files.walk(dir)) {
                for (Path d : (Iterable<Path>) dirs.filter(Files::isDirectory)::iterator) registerOne(d);
            }
        } else {
            registerOne(dir);
        }
    }

    private void registerOne(Path dir) throws IOException {
        WatchKey key = dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
        keys.put(key, dir);
    }

    /**
     * Feeds all buffered create/modify events of matching files into {@code detector}.
     *
     * @return number of file events forwarded.
     */
    public int drainEvents(CompletionDetector detector) {
        int forwarded = 0;
        try {
            WatchKey key;
            while ((key = watchService.poll()) != null) {
                Path dir = keys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        LOGGER.warning("Watch events overflowed in " + dir + "; some writes may be missed");
                        continue;
                    }
                    if (dir == null) continue;
                    Path path = dir.resolve((Path) event.context());
                    if (Files.isDirectory(path)) {
                        if (recursive && event.kind() == StandardWatchEventKinds.ENTRY_CREATE) registerQuietly(path);
                        continue;
                    }
                    if (matches(path)) {
                        detector.recordEvent(path);
                        forwarded++;
                    }
                }
                if (!key.reset()) keys.remove(key);
            }
        } catch (ClosedWatchServiceException e) {
            LOGGER.fine("Watch service closed while draining events");
        }
        return forwarded;
    }

    private void registerQuietly(Path dir) {
        try {
            register(dir);
        } catch (IOException e) {
            LOGGER.warning("Cannot watch new directory " + dir + ": " + e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        LOGGER.info("Stopping file watcher");
        watchService.close();
    }
}
