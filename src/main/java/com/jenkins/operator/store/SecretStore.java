package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to namespaced secrets.
 */
public interface SecretStore {

    /**
     * Returns the data of a secret.
     *
     * @return the secret data, or empty if the secret does not exist
     * @throws ReconcileException if the store could not be reached
     */
    Optional<Map<String, byte[]>> get(String namespace, String name) throws ReconcileException;
}
