package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1ConfigMapList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.HttpURLConnection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ConfigMapSource} backed by the Kubernetes core API.
 */
@Component
public class KubernetesConfigMapSource implements ConfigMapSource {
    private final GenericKubernetesApi<V1ConfigMap, V1ConfigMapList> configMapApi;

    @Autowired
    public KubernetesConfigMapSource(ApiClient apiClient) {
        this(new GenericKubernetesApi<>(V1ConfigMap.class, V1ConfigMapList.class, "", "v1", "configmaps", apiClient));
    }

    KubernetesConfigMapSource(GenericKubernetesApi<V1ConfigMap, V1ConfigMapList> configMapApi) {
        this.configMapApi = configMapApi;
    }

    @Override
    public Optional<Map<String, String>> get(String namespace, String name) throws ReconcileException {
        KubernetesApiResponse<V1ConfigMap> response;
        try {
            response = configMapApi.get(namespace, name);
        } catch (RuntimeException e) {
            throw new ReconcileException(String.format("Failed to get config map %s/%s", namespace, name), e);
        }

        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw new ReconcileException(String.format("Failed to get config map %s/%s: HTTP %d",
                    namespace, name, response.getHttpStatusCode()));
        }

        Map<String, String> data = response.getObject().getData();
        return Optional.of(data != null ? data : Collections.emptyMap());
    }
}
