package com.jenkins.operator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Jenkins Kubernetes Operator.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class JenkinsOperatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(JenkinsOperatorApplication.class, args);
    }
}
