package com.jenkins.operator.configuration.user.seedjobs;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Classified outcome of a seed job step and the control action it maps to.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class SeedJobDecision {

    public enum Classification {
        DONE,
        PENDING,
        RECOVERABLE,
        UNRECOVERABLE,
        INFRASTRUCTURE_ERROR
    }

    public enum Action {
        /** Continue with the next step. */
        PROCEED,
        /** Re-run the reconcile after {@link #getRequeueAfter()}. */
        REQUEUE,
        /** Stop without requeueing. */
        STOP,
        /** Hand {@link #getCause()} to the caller. */
        PROPAGATE
    }

    private final Classification classification;
    private final Action action;
    private final Duration requeueAfter;
    private final Exception cause;
}
