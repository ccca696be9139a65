package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.HttpURLConnection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SecretStore} backed by the Kubernetes core API.
 */
@Component
public class KubernetesSecretStore implements SecretStore {
    private final GenericKubernetesApi<V1Secret, V1SecretList> secretApi;

    @Autowired
    public KubernetesSecretStore(ApiClient apiClient) {
        this(new GenericKubernetesApi<>(V1Secret.class, V1SecretList.class, "", "v1", "secrets", apiClient));
    }

    KubernetesSecretStore(GenericKubernetesApi<V1Secret, V1SecretList> secretApi) {
        this.secretApi = secretApi;
    }

    @Override
    public Optional<Map<String, byte[]>> get(String namespace, String name) throws ReconcileException {
        KubernetesApiResponse<V1Secret> response;
        try {
            response = secretApi.get(namespace, name);
        } catch (RuntimeException e) {
            throw new ReconcileException(String.format("Failed to get secret %s/%s", namespace, name), e);
        }

        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw new ReconcileException(String.format("Failed to get secret %s/%s: HTTP %d",
                    namespace, name, response.getHttpStatusCode()));
        }

        Map<String, byte[]> data = response.getObject().getData();
        return Optional.of(data != null ? data : Collections.emptyMap());
    }
}
