package com.jenkins.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Specification for a Jenkins custom resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JenkinsSpec {
    private JenkinsMaster master;
    private List<SeedJob> seedJobs;
}
