package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to namespaced config maps.
 */
public interface ConfigMapSource {

    /**
     * Returns the data of a config map, or empty if it does not exist.
     */
    Optional<Map<String, String>> get(String namespace, String name) throws ReconcileException;
}
