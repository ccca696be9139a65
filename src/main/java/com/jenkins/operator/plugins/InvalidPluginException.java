package com.jenkins.operator.plugins;

/**
 * Thrown when a plugin token cannot be parsed into a name and a version.
 */
public class InvalidPluginException extends Exception {

    public InvalidPluginException(String message) {
        super(message);
    }
}
