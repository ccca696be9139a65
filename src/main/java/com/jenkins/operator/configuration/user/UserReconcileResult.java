package com.jenkins.operator.configuration.user;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Result of one user configuration step.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class UserReconcileResult {

    public enum Outcome {
        COMPLETED,
        REQUEUE,
        STOPPED
    }

    private final Outcome outcome;
    private final Duration requeueAfter;

    public static UserReconcileResult completed() {
        return new UserReconcileResult(Outcome.COMPLETED, null);
    }

    public static UserReconcileResult requeue(Duration requeueAfter) {
        return new UserReconcileResult(Outcome.REQUEUE, requeueAfter);
    }

    public static UserReconcileResult stopped() {
        return new UserReconcileResult(Outcome.STOPPED, null);
    }
}
