package com.jenkins.operator.event;

/**
 * Machine readable reasons attached to emitted events.
 */
public enum Reason {
    BASE_CONFIGURATION_SUCCESS("BaseConfigurationSuccess"),
    USER_CONFIGURATION_SUCCESS("UserConfigurationSuccess"),
    CR_VALIDATION_FAILURE("CRValidationFailure"),
    SEED_JOB_BUILD_FAILURE("SeedJobBuildFailure");

    private final String value;

    Reason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
