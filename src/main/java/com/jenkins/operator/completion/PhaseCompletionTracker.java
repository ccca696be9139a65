package com.jenkins.operator.completion;

import com.jenkins.operator.model.JenkinsStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Records the first completion of each phase on a status.
 *
 * <p>The completion timestamp is the only record. Callers must persist the status and only
 * then announce the completion; a failed persist leaves the stored status unstamped, so the
 * next reconcile, working on a freshly fetched status, fires again.
 */
@Component
@RequiredArgsConstructor
public class PhaseCompletionTracker {
    private final Clock clock;

    /**
     * Stamps the phase completion time unless it is already set.
     *
     * @return {@code true} if this call stamped the phase, {@code false} if it was already stamped
     */
    public boolean markOnce(JenkinsStatus status, Phase phase) {
        if (phase.completedTime(status).isPresent()) {
            return false;
        }
        phase.stamp(status, OffsetDateTime.now(clock));
        return true;
    }
}
