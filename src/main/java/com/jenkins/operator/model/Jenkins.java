package com.jenkins.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents a Jenkins custom resource.
 */
@Data
public class Jenkins implements KubernetesObject {
    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private JenkinsSpec spec;
    private JenkinsStatus status;
}
