package com.jenkins.operator.plugins;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plugins the operator installs on every Jenkins master.
 */
public final class BasePlugins {
    private static final String APACHE_HTTP_CLIENT = "apache-httpcomponents-client-4-api:4.5.5-3.0";
    private static final String CREDENTIALS = "credentials:2.1.18";
    private static final String SCM_API = "scm-api:2.3.0";
    private static final String SCRIPT_SECURITY = "script-security:1.48";
    private static final String STRUCTS = "structs:1.17";
    private static final String WORKFLOW_API = "workflow-api:2.29";
    private static final String WORKFLOW_STEP_API = "workflow-step-api:2.16";
    private static final String WORKFLOW_SUPPORT = "workflow-support:2.20";
    private static final String WORKFLOW_SCM_STEP = "workflow-scm-step:2.7";
    private static final String WORKFLOW_JOB = "workflow-job:2.25";

    private BasePlugins() {
    }

    /**
     * Returns a fresh copy of the operator-managed plugin declarations.
     */
    public static Map<String, List<String>> basePlugins() {
        Map<String, List<String>> plugins = new LinkedHashMap<>();
        plugins.put("configuration-as-code:1.4", List.of("configuration-as-code-support:1.4"));
        plugins.put("git:3.9.1", List.of(
                APACHE_HTTP_CLIENT,
                CREDENTIALS,
                "display-url-api:2.2.0",
                "git-client:2.7.3",
                "jsch:0.1.54.2",
                "junit:1.24",
                "mailer:1.21",
                "matrix-project:1.13",
                SCM_API,
                SCRIPT_SECURITY,
                "ssh-credentials:1.14",
                STRUCTS,
                WORKFLOW_API,
                WORKFLOW_SCM_STEP,
                WORKFLOW_STEP_API));
        plugins.put("job-dsl:1.70", List.of(SCRIPT_SECURITY, STRUCTS));
        plugins.put("kubernetes:1.13.5", List.of(
                APACHE_HTTP_CLIENT,
                "cloudbees-folder:6.5.1",
                CREDENTIALS,
                "durable-task:1.26",
                "jackson2-api:2.9.7",
                "kubernetes-credentials:0.4.0",
                "plain-credentials:1.4",
                STRUCTS,
                "variant:1.1",
                WORKFLOW_STEP_API));
        plugins.put(WORKFLOW_JOB, List.of(
                SCM_API,
                SCRIPT_SECURITY,
                STRUCTS,
                WORKFLOW_API,
                WORKFLOW_STEP_API,
                WORKFLOW_SUPPORT));
        plugins.put("workflow-aggregator:2.5", List.of(
                "workflow-cps:2.59",
                WORKFLOW_API,
                WORKFLOW_JOB,
                WORKFLOW_SCM_STEP,
                WORKFLOW_STEP_API,
                WORKFLOW_SUPPORT));
        return plugins;
    }
}
