package com.jenkins.operator.model;

import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Status for a Jenkins custom resource.
 *
 * <p>A phase counts as completed exactly when its timestamp is set.
 */
@Data
public class JenkinsStatus {
    private OffsetDateTime provisionStartTime;
    private OffsetDateTime baseConfigurationCompletedTime;
    private OffsetDateTime userConfigurationCompletedTime;
}
