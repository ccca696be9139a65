package com.jenkins.operator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Operator settings bound from {@code jenkins.operator.*}.
 */
@Data
@ConfigurationProperties(prefix = "jenkins.operator")
public class OperatorProperties {

    /**
     * Log failed reconcile loops with their stack trace.
     */
    private boolean debug = false;

    /**
     * Delay before re-running a reconcile that waits on a seed job build or on the user configuration job.
     */
    private Duration requeueDelay = Duration.ofSeconds(10);

    private Duration resyncPeriod = Duration.ofMinutes(1);

    private int workerCount = 2;

    private String defaultMasterImage = Constants.DEFAULT_MASTER_IMAGE;
}
