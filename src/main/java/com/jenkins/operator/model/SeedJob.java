package com.jenkins.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Specification for a Jenkins seed job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeedJob {
    private String id;
    private String targets;
    private String description;
    private String repositoryBranch;
    private String repositoryUrl;
    private PrivateKey privateKey;
}
