package com.jenkins.operator.configuration.user.groovy;

import com.jenkins.operator.client.JenkinsClient;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;

import java.util.Map;

/**
 * Applies user supplied groovy scripts to the Jenkins master through a dedicated job.
 */
public interface ScriptedConfigurationRunner {

    /**
     * Creates or updates the job that runs the configuration scripts.
     */
    void configureJob(Jenkins jenkins, JenkinsClient client) throws ReconcileException;

    /**
     * Runs the scripts that have not been applied yet.
     *
     * @param configuration script names mapped to script content
     * @return {@code true} once every script has been applied
     */
    boolean ensureJob(Map<String, String> configuration, Jenkins jenkins, JenkinsClient client)
            throws ReconcileException;
}
