package com.jenkins.operator.configuration.user.seedjobs;

import com.jenkins.operator.client.JenkinsClient;
import com.jenkins.operator.config.OperatorProperties;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the seed job step and decides how the reconcile loop continues.
 *
 * <table>
 *   <caption>Classification to action</caption>
 *   <tr><th>Classification</th><th>Action</th></tr>
 *   <tr><td>DONE</td><td>proceed</td></tr>
 *   <tr><td>PENDING</td><td>requeue after the configured delay</td></tr>
 *   <tr><td>RECOVERABLE</td><td>requeue after the configured delay</td></tr>
 *   <tr><td>UNRECOVERABLE</td><td>stop, the seed job configuration has to be fixed</td></tr>
 *   <tr><td>INFRASTRUCTURE_ERROR</td><td>propagate the error</td></tr>
 * </table>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeedJobRetryPolicy {
    private final SeedJobRunner seedJobRunner;
    private final OperatorProperties properties;

    public SeedJobDecision ensureSeedJobs(Jenkins jenkins, JenkinsClient client) {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();

        SeedJobResult result;
        try {
            result = seedJobRunner.ensureSeedJobs(jenkins, client);
        } catch (ReconcileException e) {
            return new SeedJobDecision(SeedJobDecision.Classification.INFRASTRUCTURE_ERROR,
                    SeedJobDecision.Action.PROPAGATE, null, e);
        }
        if (result == null) {
            return new SeedJobDecision(SeedJobDecision.Classification.INFRASTRUCTURE_ERROR,
                    SeedJobDecision.Action.PROPAGATE, null, new ReconcileException(String.format(
                            "Seed job runner reported no result for Jenkins %s/%s", namespace, name)));
        }

        SeedJobDecision.Classification classification = classify(result);
        switch (classification) {
            case DONE:
                return new SeedJobDecision(classification, SeedJobDecision.Action.PROCEED, null, null);
            case PENDING:
                log.debug("Seed job builds of Jenkins {}/{} not finished yet", namespace, name);
                return new SeedJobDecision(classification, SeedJobDecision.Action.REQUEUE,
                        properties.getRequeueDelay(), null);
            case RECOVERABLE:
                log.warn("Seed job build of Jenkins {}/{} failed, retrying in {}",
                        namespace, name, properties.getRequeueDelay());
                return new SeedJobDecision(classification, SeedJobDecision.Action.REQUEUE,
                        properties.getRequeueDelay(), null);
            default:
                log.warn("Seed job build of Jenkins {}/{} failed and cannot be recovered, "
                        + "fix the seed job configuration", namespace, name);
                return new SeedJobDecision(classification, SeedJobDecision.Action.STOP, null, null);
        }
    }

    static SeedJobDecision.Classification classify(SeedJobResult result) {
        switch (result) {
            case DONE:
                return SeedJobDecision.Classification.DONE;
            case IN_PROGRESS:
                return SeedJobDecision.Classification.PENDING;
            case RECOVERABLE_FAILURE:
                return SeedJobDecision.Classification.RECOVERABLE;
            case UNRECOVERABLE_FAILURE:
                return SeedJobDecision.Classification.UNRECOVERABLE;
            default:
                throw new IllegalArgumentException("Unknown seed job result " + result);
        }
    }
}
