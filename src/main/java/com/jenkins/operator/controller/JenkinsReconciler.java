package com.jenkins.operator.controller;

import com.jenkins.operator.config.OperatorProperties;
import com.jenkins.operator.configuration.base.BaseConfigurationValidator;
import com.jenkins.operator.configuration.base.BaseProvisioner;
import com.jenkins.operator.configuration.base.BaseReconcileResult;
import com.jenkins.operator.configuration.base.JenkinsDefaults;
import com.jenkins.operator.configuration.user.UserConfigurationReconciler;
import com.jenkins.operator.configuration.user.UserConfigurationValidator;
import com.jenkins.operator.configuration.user.UserReconcileResult;
import com.jenkins.operator.completion.Phase;
import com.jenkins.operator.completion.PhaseCompletionTracker;
import com.jenkins.operator.event.EventEmitter;
import com.jenkins.operator.event.EventType;
import com.jenkins.operator.event.Reason;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsStatus;
import com.jenkins.operator.store.JenkinsRepository;
import com.jenkins.operator.store.UpdateResult;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Reconciler for Jenkins resources.
 *
 * <p>Each pass fetches the resource and walks the phases in order: defaulting, base
 * validation, base provisioning, user validation, user configuration. A phase only runs once
 * every earlier phase holds for the freshly fetched resource; nothing is kept between passes
 * except what is persisted on the resource.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JenkinsReconciler implements Reconciler {
    private final JenkinsRepository repository;
    private final JenkinsDefaults defaults;
    private final BaseConfigurationValidator baseValidator;
    private final BaseProvisioner baseProvisioner;
    private final UserConfigurationValidator userValidator;
    private final UserConfigurationReconciler userConfiguration;
    private final PhaseCompletionTracker completionTracker;
    private final EventEmitter eventEmitter;
    private final OperatorProperties properties;
    private final Clock clock;

    @Override
    public Result reconcile(Request request) {
        log.debug("Reconciling Jenkins {}/{}", request.getNamespace(), request.getName());

        try {
            return reconcile(request.getNamespace(), request.getName());
        } catch (ReconcileException e) {
            if (properties.isDebug()) {
                log.warn("Reconcile loop failed for Jenkins {}/{}", request.getNamespace(), request.getName(), e);
            } else {
                log.warn("Reconcile loop failed for Jenkins {}/{}: {}",
                        request.getNamespace(), request.getName(), e.getMessage());
            }
            return new Result(true);
        }
    }

    Result reconcile(String namespace, String name) throws ReconcileException {
        // Fetch the Jenkins instance
        Optional<Jenkins> found = repository.find(namespace, name);
        if (found.isEmpty()) {
            // Deleted after the request was queued, owned objects are garbage collected
            log.debug("Jenkins {}/{} not found", namespace, name);
            return new Result(false);
        }
        Jenkins jenkins = withStatus(found.get());

        if (defaults.apply(jenkins)) {
            Optional<Jenkins> saved = persist(repository.update(jenkins), namespace, name);
            if (saved.isEmpty()) {
                return new Result(true);
            }
            jenkins = saved.get();
        }

        // Base configuration
        if (!baseValidator.validate(jenkins) || !baseProvisioner.validate(jenkins)) {
            log.warn("Validation of base configuration failed for Jenkins {}/{}, please correct the Jenkins CR",
                    namespace, name);
            eventEmitter.emit(jenkins, EventType.WARNING, Reason.CR_VALIDATION_FAILURE, "Base CR validation failed");
            return new Result(false);
        }

        if (jenkins.getStatus().getProvisionStartTime() == null) {
            jenkins.getStatus().setProvisionStartTime(OffsetDateTime.now(clock));
            Optional<Jenkins> saved = persist(repository.updateStatus(jenkins), namespace, name);
            if (saved.isEmpty()) {
                return new Result(true);
            }
            jenkins = saved.get();
        }

        BaseReconcileResult base = baseProvisioner.reconcile(jenkins);
        if (base.isRequeue()) {
            return base.getRequeueAfter() != null ? new Result(true, base.getRequeueAfter()) : new Result(true);
        }
        if (base.getClient() == null) {
            throw new ReconcileException(String.format(
                    "Base configuration of Jenkins %s/%s completed without a Jenkins client", namespace, name));
        }

        Optional<Jenkins> afterBase = completePhase(jenkins, Phase.BASE, Reason.BASE_CONFIGURATION_SUCCESS);
        if (afterBase.isEmpty()) {
            return new Result(true);
        }
        jenkins = afterBase.get();

        // User configuration
        if (!userValidator.validate(jenkins)) {
            log.warn("Validation of user configuration failed for Jenkins {}/{}, please correct the Jenkins CR",
                    namespace, name);
            eventEmitter.emit(jenkins, EventType.WARNING, Reason.CR_VALIDATION_FAILURE, "User CR validation failed");
            return new Result(false);
        }

        UserReconcileResult user = userConfiguration.reconcile(jenkins, base.getClient());
        switch (user.getOutcome()) {
            case REQUEUE:
                return new Result(true, user.getRequeueAfter());
            case STOPPED:
                eventEmitter.emit(jenkins, EventType.WARNING, Reason.SEED_JOB_BUILD_FAILURE,
                        "Seed job build failed and cannot be recovered, please correct the seed job configuration");
                return new Result(false);
            default:
                break;
        }

        if (completePhase(jenkins, Phase.USER, Reason.USER_CONFIGURATION_SUCCESS).isEmpty()) {
            return new Result(true);
        }
        return new Result(false);
    }

    /**
     * Stamps, persists and announces the first completion of a phase.
     *
     * @return the persisted resource, or empty if the write hit a conflict
     */
    private Optional<Jenkins> completePhase(Jenkins jenkins, Phase phase, Reason reason) throws ReconcileException {
        if (!completionTracker.markOnce(jenkins.getStatus(), phase)) {
            return Optional.of(jenkins);
        }

        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();
        Optional<Jenkins> saved = persist(repository.updateStatus(jenkins), namespace, name);
        if (saved.isEmpty()) {
            return saved;
        }

        log.info("{} phase of Jenkins {}/{} is complete, took {}",
                phase.getDisplayName(), namespace, name, elapsed(jenkins.getStatus(), phase));
        eventEmitter.emit(jenkins, EventType.NORMAL, reason, phase.getDisplayName() + " completed");
        return saved;
    }

    /**
     * Unwraps a write result.
     *
     * @return the written resource, or empty on a conflict; the caller requeues immediately
     * @throws ReconcileException on any other failure
     */
    private Optional<Jenkins> persist(UpdateResult<Jenkins> result, String namespace, String name)
            throws ReconcileException {
        switch (result.getOutcome()) {
            case SUCCESS:
                if (result.getObject() == null) {
                    throw new ReconcileException(String.format(
                            "Write of Jenkins %s/%s returned no object", namespace, name));
                }
                return Optional.of(withStatus(result.getObject()));
            case CONFLICT:
                log.debug("Jenkins {}/{} was modified concurrently, requeueing: {}",
                        namespace, name, result.getMessage());
                return Optional.empty();
            default:
                throw new ReconcileException(result.getMessage(), result.getCause());
        }
    }

    private static Jenkins withStatus(Jenkins jenkins) {
        if (jenkins.getStatus() == null) {
            jenkins.setStatus(new JenkinsStatus());
        }
        return jenkins;
    }

    private static Object elapsed(JenkinsStatus status, Phase phase) {
        OffsetDateTime start = status.getProvisionStartTime();
        Optional<OffsetDateTime> completed = phase.completedTime(status);
        if (start == null || completed.isEmpty()) {
            return "unknown";
        }
        return Duration.between(start, completed.get());
    }
}
