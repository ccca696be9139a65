package com.jenkins.operator.configuration.base;

import com.jenkins.operator.client.JenkinsClient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Result of one base provisioning step.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class BaseReconcileResult {
    private final boolean requeue;
    private final Duration requeueAfter;
    private final JenkinsClient client;

    public static BaseReconcileResult completed(JenkinsClient client) {
        return new BaseReconcileResult(false, null, client);
    }

    public static BaseReconcileResult requeue(Duration requeueAfter) {
        return new BaseReconcileResult(true, requeueAfter, null);
    }
}
