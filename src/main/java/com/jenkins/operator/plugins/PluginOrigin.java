package com.jenkins.operator.plugins;

/**
 * Declaration group a plugin entry came from. Only used in diagnostics.
 */
public enum PluginOrigin {
    OPERATOR("operatorPlugins"),
    USER("plugins");

    private final String fieldName;

    PluginOrigin(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
