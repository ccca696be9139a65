package com.jenkins.operator.configuration.user;

import com.jenkins.operator.client.JenkinsClient;
import com.jenkins.operator.config.Constants;
import com.jenkins.operator.config.OperatorProperties;
import com.jenkins.operator.configuration.user.groovy.ScriptedConfigurationRunner;
import com.jenkins.operator.configuration.user.seedjobs.SeedJobDecision;
import com.jenkins.operator.configuration.user.seedjobs.SeedJobRetryPolicy;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.store.ConfigMapSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Applies the user supplied configuration: seed jobs first, then the groovy scripts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserConfigurationReconciler {
    private final SeedJobRetryPolicy seedJobRetryPolicy;
    private final ScriptedConfigurationRunner scriptedConfigurationRunner;
    private final ConfigMapSource configMapSource;
    private final OperatorProperties properties;

    public UserReconcileResult reconcile(Jenkins jenkins, JenkinsClient client) throws ReconcileException {
        SeedJobDecision seedJobs = seedJobRetryPolicy.ensureSeedJobs(jenkins, client);
        switch (seedJobs.getAction()) {
            case REQUEUE:
                return UserReconcileResult.requeue(seedJobs.getRequeueAfter());
            case STOP:
                return UserReconcileResult.stopped();
            case PROPAGATE:
                throw new ReconcileException(String.format("Failed to ensure seed jobs of Jenkins %s/%s",
                        jenkins.getMetadata().getNamespace(), jenkins.getMetadata().getName()), seedJobs.getCause());
            default:
                break;
        }

        return ensureUserConfiguration(jenkins, client);
    }

    private UserReconcileResult ensureUserConfiguration(Jenkins jenkins, JenkinsClient client)
            throws ReconcileException {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();

        scriptedConfigurationRunner.configureJob(jenkins, client);

        String configMapName = Constants.userConfigurationConfigMapName(name);
        Map<String, String> configuration = configMapSource.get(namespace, configMapName)
                .orElseThrow(() -> new ReconcileException(String.format(
                        "User configuration config map %s/%s of Jenkins %s/%s not found",
                        namespace, configMapName, namespace, name)));

        if (!scriptedConfigurationRunner.ensureJob(configuration, jenkins, client)) {
            log.debug("User configuration of Jenkins {}/{} not applied yet", namespace, name);
            return UserReconcileResult.requeue(properties.getRequeueDelay());
        }
        return UserReconcileResult.completed();
    }
}
