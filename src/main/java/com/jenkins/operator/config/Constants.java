package com.jenkins.operator.config;

/**
 * Constants shared across the operator.
 */
public final class Constants {

    private Constants() {
    }

    // Custom resource
    public static final String GROUP = "jenkins.io";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;
    public static final String PLURAL = "jenkins";
    public static final String KIND = "Jenkins";

    public static final String OPERATOR_NAME = "jenkins-operator";

    // Defaults applied to the master
    public static final String DEFAULT_MASTER_IMAGE = "jenkins/jenkins:lts";
    public static final String DEFAULT_USER_PLUGIN = "simple-theme-plugin:0.5.1";
    public static final String DEFAULT_REQUEST_CPU = "1";
    public static final String DEFAULT_REQUEST_MEMORY = "500Mi";
    public static final String DEFAULT_LIMIT_CPU = "1500m";
    public static final String DEFAULT_LIMIT_MEMORY = "3Gi";
    public static final String RESOURCE_CPU = "cpu";
    public static final String RESOURCE_MEMORY = "memory";

    // User configuration
    public static final String USER_CONFIGURATION_CONFIG_MAP_PREFIX = OPERATOR_NAME + "-user-configuration-";
    public static final String SSH_REPOSITORY_MARKER = "git@";

    public static String userConfigurationConfigMapName(String jenkinsName) {
        return USER_CONFIGURATION_CONFIG_MAP_PREFIX + jenkinsName;
    }
}
