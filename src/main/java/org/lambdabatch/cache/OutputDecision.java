package org.lambdabatch.cache;

/**
 * What to do with one artifact before processing an image.
 */
public enum OutputDecision {
    /** Present and valid: reuse it. */
    SKIP,
    /** Present but unreadable, of the wrong shape, or part of a map group that must be rewritten. */
    INVALID,
    /** Not on disk, or overwrite was requested. */
    ABSENT;

    public boolean needsRegeneration() {
        return this != SKIP;
    }
}
