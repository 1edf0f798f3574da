package org.lambdabatch.watch;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A file that is still being written, with the time of its last observed write event.
 */
public record PendingFile(Path path, Instant lastModified) {
}
