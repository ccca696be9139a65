package com.jenkins.operator.model;

import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Desired configuration of the Jenkins master.
 *
 * <p>Both plugin groups map a root plugin token ({@code name:version}) to the tokens of the
 * plugins it depends on. {@code operatorPlugins} is managed by the operator and defaulted,
 * {@code plugins} is authored by the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JenkinsMaster {
    private String image;
    private Map<String, List<String>> operatorPlugins;
    private Map<String, List<String>> plugins;
    private V1ResourceRequirements resources;
}
