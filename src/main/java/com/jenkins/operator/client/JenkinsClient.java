package com.jenkins.operator.client;

/**
 * Handle to a provisioned Jenkins master.
 *
 * <p>The {@link com.jenkins.operator.configuration.base.BaseProvisioner} creates it once the
 * master is ready, and the reconciler hands it unchanged to the seed job and scripted
 * configuration runners. The reconcile core never talks to Jenkins through it.
 */
public interface JenkinsClient {
}
