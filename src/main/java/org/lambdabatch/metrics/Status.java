package org.lambdabatch.metrics;

/**
 * Represents the status of a processed file set.
 */
public enum Status {
    PASS, // every image processed or skipped
    PARTIAL, // completed with some failed images
    FAIL // aborted, or no image succeeded
}
