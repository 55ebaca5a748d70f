package com.seqdecision.server.ai.simulation;

/**
 * What a batch does when a single run fails.
 */
public enum FailurePolicy {
    /** Propagate the first failure and discard the batch. */
    ABORT,
    /** Count the failed run and leave it out of the collected series. */
    SKIP
}
