package com.jenkins.operator.completion;

import com.jenkins.operator.model.JenkinsStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseCompletionTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private PhaseCompletionTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new PhaseCompletionTracker(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testMarkOnceStampsFirstCompletion() {
        // Given
        JenkinsStatus status = new JenkinsStatus();

        // When
        boolean marked = tracker.markOnce(status, Phase.BASE);

        // Then
        assertThat(marked).isTrue();
        assertThat(status.getBaseConfigurationCompletedTime()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(status.getUserConfigurationCompletedTime()).isNull();
    }

    @Test
    void testMarkOnceKeepsExistingTimestamp() {
        // Given
        OffsetDateTime earlier = OffsetDateTime.parse("2024-04-30T08:00:00Z");
        JenkinsStatus status = new JenkinsStatus();
        status.setUserConfigurationCompletedTime(earlier);

        // When
        boolean marked = tracker.markOnce(status, Phase.USER);

        // Then
        assertThat(marked).isFalse();
        assertThat(status.getUserConfigurationCompletedTime()).isEqualTo(earlier);
    }

    @Test
    void testMarkOnceTwice() {
        JenkinsStatus status = new JenkinsStatus();

        assertThat(tracker.markOnce(status, Phase.USER)).isTrue();
        OffsetDateTime stamped = status.getUserConfigurationCompletedTime();
        assertThat(tracker.markOnce(status, Phase.USER)).isFalse();
        assertThat(status.getUserConfigurationCompletedTime()).isEqualTo(stamped);
    }

    @Test
    void testPhasesAreIndependent() {
        JenkinsStatus status = new JenkinsStatus();

        assertThat(tracker.markOnce(status, Phase.BASE)).isTrue();
        assertThat(tracker.markOnce(status, Phase.USER)).isTrue();
        assertThat(Phase.BASE.completedTime(status)).isPresent();
        assertThat(Phase.USER.completedTime(status)).isPresent();
    }
}
