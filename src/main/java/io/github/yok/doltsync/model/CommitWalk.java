package io.github.yok.doltsync.model;

/**
 * How a commit range is split into steps during forward sync.
 */
public enum CommitWalk {

    /**
     * One step per commit in the range; the cursor can stop at every intermediate commit.
     */
    PER_COMMIT,

    /**
     * A single step covering the whole range.
     */
    RANGE
}
