package com.jenkins.operator.runner;

import io.kubernetes.client.extended.controller.ControllerManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runner to start the Jenkins controller manager.
 */
@Component
@Slf4j
public class ControllerRunner implements CommandLineRunner {
    private final ControllerManager controllerManager;

    @Autowired
    public ControllerRunner(ControllerManager controllerManager) {
        this.controllerManager = controllerManager;
    }

    @Override
    public void run(String... args) {
        // The manager starts the registered informers before its controllers
        log.info("Starting Jenkins controller manager");
        controllerManager.run();
    }
}
