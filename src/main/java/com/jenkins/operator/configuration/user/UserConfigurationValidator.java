package com.jenkins.operator.configuration.user;

import com.jenkins.operator.config.Constants;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.SeedJob;
import com.jenkins.operator.store.SecretStore;
import io.kubernetes.client.openapi.models.V1SecretKeySelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Validates the seed job declarations of a Jenkins specification.
 *
 * <p>Every seed job is checked and every problem is logged before the verdict is returned.
 * Only a failure to read from the secret store is raised as an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserConfigurationValidator {
    private final SecretStore secretStore;
    private final PrivateKeyValidator privateKeyValidator;

    public boolean validate(Jenkins jenkins) throws ReconcileException {
        if (jenkins.getSpec() == null || jenkins.getSpec().getSeedJobs() == null) {
            return true;
        }

        boolean valid = true;
        for (SeedJob seedJob : jenkins.getSpec().getSeedJobs()) {
            if (seedJob == null) {
                log.warn("Empty seed job entry in Jenkins {}/{}",
                        jenkins.getMetadata().getNamespace(), jenkins.getMetadata().getName());
                valid = false;
                continue;
            }
            if (!validateSeedJob(jenkins, seedJob)) {
                valid = false;
            }
        }
        return valid;
    }

    private boolean validateSeedJob(Jenkins jenkins, SeedJob seedJob) throws ReconcileException {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();
        boolean valid = true;

        if (seedJob.getId() == null || seedJob.getId().isEmpty()) {
            log.warn("Seed job id can't be empty in Jenkins {}/{}: {}", namespace, name, seedJob);
            valid = false;
        }

        V1SecretKeySelector keyRef = seedJob.getPrivateKey() != null ? seedJob.getPrivateKey().getSecretKeyRef() : null;
        String repositoryUrl = seedJob.getRepositoryUrl();
        if (repositoryUrl != null && repositoryUrl.contains(Constants.SSH_REPOSITORY_MARKER) && keyRef == null) {
            log.warn("Private key can't be empty while using ssh repository url in Jenkins {}/{}: {}",
                    namespace, name, seedJob);
            valid = false;
        }

        if (keyRef != null && !validatePrivateKey(namespace, name, seedJob, keyRef)) {
            valid = false;
        }
        return valid;
    }

    private boolean validatePrivateKey(String namespace, String name, SeedJob seedJob, V1SecretKeySelector keyRef)
            throws ReconcileException {
        Optional<Map<String, byte[]>> secret = secretStore.get(namespace, keyRef.getName());
        if (secret.isEmpty()) {
            log.warn("Secret '{}' not found for seed job '{}' in Jenkins {}/{}",
                    keyRef.getName(), seedJob.getId(), namespace, name);
            return false;
        }

        byte[] value = keyRef.getKey() != null ? secret.get().get(keyRef.getKey()) : null;
        if (value == null || value.length == 0) {
            log.warn("Private key '{}' is empty in secret '{}' for seed job '{}' in Jenkins {}/{}",
                    keyRef.getKey(), keyRef.getName(), seedJob.getId(), namespace, name);
            return false;
        }

        try {
            privateKeyValidator.validate(new String(value, StandardCharsets.UTF_8));
        } catch (InvalidPrivateKeyException e) {
            log.warn("Private key is invalid for seed job '{}' in Jenkins {}/{}: {}",
                    seedJob.getId(), namespace, name, e.getMessage());
            return false;
        }
        return true;
    }
}
