package com.jenkins.operator.completion;

import com.jenkins.operator.model.JenkinsStatus;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Top level reconcile stages whose completion is recorded on the status.
 */
public enum Phase {
    BASE("Base configuration",
            JenkinsStatus::getBaseConfigurationCompletedTime,
            JenkinsStatus::setBaseConfigurationCompletedTime),
    USER("User configuration",
            JenkinsStatus::getUserConfigurationCompletedTime,
            JenkinsStatus::setUserConfigurationCompletedTime);

    private final String displayName;
    private final Function<JenkinsStatus, OffsetDateTime> getter;
    private final BiConsumer<JenkinsStatus, OffsetDateTime> setter;

    Phase(String displayName,
          Function<JenkinsStatus, OffsetDateTime> getter,
          BiConsumer<JenkinsStatus, OffsetDateTime> setter) {
        this.displayName = displayName;
        this.getter = getter;
        this.setter = setter;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Optional<OffsetDateTime> completedTime(JenkinsStatus status) {
        return Optional.ofNullable(getter.apply(status));
    }

    void stamp(JenkinsStatus status, OffsetDateTime time) {
        setter.accept(status, time);
    }
}
