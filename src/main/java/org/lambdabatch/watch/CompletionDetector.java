package org.lambdabatch.watch;

import org.lambdabatch.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Decides when a file has finished being written.
 * <p>
 * Every create or modify event (re)stamps the file as pending. {@link #poll()} reports a pending
 * file as ready once no event arrived for longer than the stability window and one byte of it can
 * be read. A file that is still locked stays pending with its old stamp and is retried on every poll.
 * A file reported ready is never reported again. Not thread safe: events and polls must come from
 * the same polling thread.
 */
public class CompletionDetector {

    private static final Logger LOGGER = Logger.getLogger(CompletionDetector.class.getName());

    private final Duration stabilityWindow;
    private final Clock clock;
    private final Predicate<Path> readProbe;
    private final Map<Path, PendingFile> pending = new LinkedHashMap<>();
    private final Set<Path> processed = new HashSet<>();

    public CompletionDetector(Duration stabilityWindow) {
        this(stabilityWindow, Clock.systemUTC(), FileUtils::canReadOneByte);
    }

    public CompletionDetector(Duration stabilityWindow, Clock clock, Predicate<Path> readProbe) {
        this.stabilityWindow = Objects.requireNonNull(stabilityWindow);
        this.clock = Objects.requireNonNull(clock);
        this.readProbe = Objects.requireNonNull(readProbe);
    }

    /**
     * Records a create or modify event for {@code path}.
     */
    public void recordEvent(Path path) {
        if (processed.contains(path)) return;
        boolean first = !pending.containsKey(path);
        pending.put(path, new PendingFile(path, clock.instant()));
        if (first) LOGGER.info("Detected new file: " + path);
    }

    /**
     * Marks a file as already handled, e.g. queued by an initial directory scan.
     */
    public void markProcessed(Path path) {
        pending.remove(path);
        processed.add(path);
    }

    /**
     * Returns the files that became ready since the last poll, in the order they were first seen.
     */
    public List<Path> poll() {
        final Instant now = clock.instant();
        final List<Path> ready = new ArrayList<>();
        for (Iterator<PendingFile> it = pending.values().iterator(); it.hasNext(); ) {
            PendingFile file = it.next();
            if (Duration.between(file.lastModified(), now).compareTo(stabilityWindow) <= 0) continue;

            if (!Files.exists(file.path())) {
                LOGGER.warning("Pending file disappeared, abandoning: " + file.path());
                it.remove();
                continue;
            }
            if (!readProbe.test(file.path())) {
                LOGGER.warning("File not yet readable: " + file.path());
                continue;
            }
            it.remove();
            processed.add(file.path());
            ready.add(file.path());
            LOGGER.info("File ready for processing: " + file.path());
        }
        return ready;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(Path path) {
        return pending.containsKey(path);
    }

    public boolean isProcessed(Path path) {
        return processed.contains(path);
    }

    public Duration stabilityWindow() {
        return stabilityWindow;
    }
}
