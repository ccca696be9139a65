package com.jenkins.operator.model;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.openapi.models.V1ListMeta;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * List type for Jenkins custom resources, required by the generic API and the informer.
 */
@Data
public class JenkinsList implements KubernetesListObject {
    private String apiVersion;
    private String kind;
    private V1ListMeta metadata;
    private List<Jenkins> items = new ArrayList<>();
}
