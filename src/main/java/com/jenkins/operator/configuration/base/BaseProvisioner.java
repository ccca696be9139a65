package com.jenkins.operator.configuration.base;

import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;

/**
 * Provisions the Jenkins master itself: pods, services, config maps and volumes.
 */
public interface BaseProvisioner {

    /**
     * Checks provisioner specific parts of the specification.
     *
     * @return {@code false} if the specification cannot be provisioned as written
     * @throws ReconcileException if the check could not be carried out
     */
    boolean validate(Jenkins jenkins) throws ReconcileException;

    /**
     * Drives the master's child resources one step towards the specification.
     *
     * @return either a requeue request while provisioning is in progress, or a client for the ready master
     */
    BaseReconcileResult reconcile(Jenkins jenkins) throws ReconcileException;
}
