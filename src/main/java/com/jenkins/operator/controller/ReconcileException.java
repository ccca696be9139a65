package com.jenkins.operator.controller;

/**
 * Failure of an operation performed while reconciling a Jenkins resource.
 *
 * <p>The message names the operation and the resource so the failure can be diagnosed from
 * the log line alone.
 */
public class ReconcileException extends Exception {

    public ReconcileException(String message) {
        super(message);
    }

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }
}
