package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.HttpURLConnection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads and writes Jenkins custom resources. Every call goes to the API server, nothing is cached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JenkinsRepository {
    private final GenericKubernetesApi<Jenkins, JenkinsList> jenkinsApi;

    /**
     * Fetches a Jenkins resource.
     *
     * @return the resource, or empty if it does not exist
     * @throws ReconcileException if the API server could not answer the request
     */
    public Optional<Jenkins> find(String namespace, String name) throws ReconcileException {
        KubernetesApiResponse<Jenkins> response;
        try {
            response = jenkinsApi.get(namespace, name);
        } catch (RuntimeException e) {
            throw new ReconcileException(String.format("Failed to get Jenkins %s/%s", namespace, name), e);
        }

        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw new ReconcileException(String.format("Failed to get Jenkins %s/%s: %s",
                    namespace, name, describe(response)));
        }
        return Optional.ofNullable(response.getObject());
    }

    /**
     * Replaces the resource, guarded by its resource version.
     */
    public UpdateResult<Jenkins> update(Jenkins jenkins) {
        return write("update", jenkins, () -> jenkinsApi.update(jenkins));
    }

    /**
     * Replaces the status subresource, guarded by the resource version.
     *
     * <p>Falls back to replacing the whole resource when the CRD does not declare the status
     * subresource, in which case the API server answers 404 on {@code /status}.
     */
    public UpdateResult<Jenkins> updateStatus(Jenkins jenkins) {
        return write("update status of", jenkins, () -> {
            KubernetesApiResponse<Jenkins> response = jenkinsApi.updateStatus(jenkins, Jenkins::getStatus);
            if (response.getHttpStatusCode() != HttpURLConnection.HTTP_NOT_FOUND) {
                return response;
            }
            log.debug("No status subresource for Jenkins {}/{}, updating the resource",
                    jenkins.getMetadata().getNamespace(), jenkins.getMetadata().getName());
            return jenkinsApi.update(jenkins);
        });
    }

    private UpdateResult<Jenkins> write(String operation, Jenkins jenkins,
                                        Supplier<KubernetesApiResponse<Jenkins>> call) {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();

        KubernetesApiResponse<Jenkins> response;
        try {
            response = call.get();
        } catch (RuntimeException e) {
            return UpdateResult.error(String.format("Failed to %s Jenkins %s/%s: %s",
                    operation, namespace, name, e.getMessage()), e);
        }

        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_CONFLICT) {
            log.debug("Conflict on {} Jenkins {}/{}: {}", operation, namespace, name, describe(response));
            return UpdateResult.conflict(describe(response));
        }
        if (!response.isSuccess()) {
            return UpdateResult.error(String.format("Failed to %s Jenkins %s/%s: %s",
                    operation, namespace, name, describe(response)));
        }
        return UpdateResult.success(response.getObject());
    }

    private static String describe(KubernetesApiResponse<?> response) {
        if (response.getStatus() != null && response.getStatus().getMessage() != null) {
            return "HTTP " + response.getHttpStatusCode() + " " + response.getStatus().getMessage();
        }
        return "HTTP " + response.getHttpStatusCode();
    }
}
