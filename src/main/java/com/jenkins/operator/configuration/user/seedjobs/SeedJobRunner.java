package com.jenkins.operator.configuration.user.seedjobs;

import com.jenkins.operator.client.JenkinsClient;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;

/**
 * Creates the seed jobs on the Jenkins master, triggers their builds and polls them.
 */
public interface SeedJobRunner {

    /**
     * Moves the seed jobs one step towards a successful build.
     *
     * @return the state of the seed job builds
     * @throws ReconcileException if Jenkins or the Kubernetes API could not be reached
     */
    SeedJobResult ensureSeedJobs(Jenkins jenkins, JenkinsClient client) throws ReconcileException;
}
