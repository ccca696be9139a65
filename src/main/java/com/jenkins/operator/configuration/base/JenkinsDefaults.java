package com.jenkins.operator.configuration.base;

import com.jenkins.operator.config.Constants;
import com.jenkins.operator.config.OperatorProperties;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsMaster;
import com.jenkins.operator.model.JenkinsSpec;
import com.jenkins.operator.plugins.BasePlugins;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills unset fields of the Jenkins master specification.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JenkinsDefaults {
    private final OperatorProperties properties;

    /**
     * Applies defaults in place.
     *
     * @return {@code true} if any field changed and the resource has to be persisted
     */
    public boolean apply(Jenkins jenkins) {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();
        boolean changed = false;

        if (jenkins.getSpec() == null) {
            jenkins.setSpec(new JenkinsSpec());
        }
        if (jenkins.getSpec().getMaster() == null) {
            jenkins.getSpec().setMaster(new JenkinsMaster());
        }
        JenkinsMaster master = jenkins.getSpec().getMaster();

        if (master.getImage() == null || master.getImage().isEmpty()) {
            log.info("Setting default Jenkins master image {} for Jenkins {}/{}",
                    properties.getDefaultMasterImage(), namespace, name);
            master.setImage(properties.getDefaultMasterImage());
            changed = true;
        }

        if (master.getOperatorPlugins() == null || master.getOperatorPlugins().isEmpty()) {
            log.info("Setting default base plugins for Jenkins {}/{}", namespace, name);
            master.setOperatorPlugins(BasePlugins.basePlugins());
            changed = true;
        }

        if (master.getPlugins() == null || master.getPlugins().isEmpty()) {
            Map<String, List<String>> plugins = new HashMap<>();
            plugins.put(Constants.DEFAULT_USER_PLUGIN, List.of());
            master.setPlugins(plugins);
            changed = true;
        }

        if (!hasAllResources(master.getResources())) {
            log.info("Setting default Jenkins master pod resource requirements for Jenkins {}/{}", namespace, name);
            master.setResources(defaultResources());
            changed = true;
        }

        return changed;
    }

    private static boolean hasAllResources(V1ResourceRequirements resources) {
        if (resources == null || resources.getRequests() == null || resources.getLimits() == null) {
            return false;
        }
        return resources.getRequests().containsKey(Constants.RESOURCE_CPU)
                && resources.getRequests().containsKey(Constants.RESOURCE_MEMORY)
                && resources.getLimits().containsKey(Constants.RESOURCE_CPU)
                && resources.getLimits().containsKey(Constants.RESOURCE_MEMORY);
    }

    private static V1ResourceRequirements defaultResources() {
        Map<String, Quantity> requests = new HashMap<>();
        requests.put(Constants.RESOURCE_CPU, Quantity.fromString(Constants.DEFAULT_REQUEST_CPU));
        requests.put(Constants.RESOURCE_MEMORY, Quantity.fromString(Constants.DEFAULT_REQUEST_MEMORY));

        Map<String, Quantity> limits = new HashMap<>();
        limits.put(Constants.RESOURCE_CPU, Quantity.fromString(Constants.DEFAULT_LIMIT_CPU));
        limits.put(Constants.RESOURCE_MEMORY, Quantity.fromString(Constants.DEFAULT_LIMIT_MEMORY));

        return new V1ResourceRequirements().requests(requests).limits(limits);
    }
}
