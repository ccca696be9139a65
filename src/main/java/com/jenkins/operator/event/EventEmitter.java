package com.jenkins.operator.event;

import com.jenkins.operator.model.Jenkins;

/**
 * Publishes events about a Jenkins resource. Delivery is best effort.
 */
public interface EventEmitter {

    void emit(Jenkins jenkins, EventType type, Reason reason, String message);
}
