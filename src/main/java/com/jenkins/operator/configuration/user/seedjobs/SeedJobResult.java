package com.jenkins.operator.configuration.user.seedjobs;

/**
 * State of the seed job builds as reported by a {@link SeedJobRunner}.
 */
public enum SeedJobResult {
    /** All seed jobs were built successfully. */
    DONE,
    /** A build is queued or running. */
    IN_PROGRESS,
    /** A build failed but may succeed when retried. */
    RECOVERABLE_FAILURE,
    /** A build failed and retries will not help until the seed job configuration changes. */
    UNRECOVERABLE_FAILURE
}
