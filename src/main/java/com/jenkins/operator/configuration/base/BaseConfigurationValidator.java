package com.jenkins.operator.configuration.base;

import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsMaster;
import com.jenkins.operator.plugins.PluginDeclarations;
import com.jenkins.operator.plugins.PluginDependencyResolver;
import com.jenkins.operator.plugins.PluginOrigin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates the master section of a Jenkins specification.
 *
 * <p>Problems are logged and reported through the return value. The validator has no I/O and
 * never throws for an invalid specification.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BaseConfigurationValidator {
    private final PluginDependencyResolver dependencyResolver;

    public boolean validate(Jenkins jenkins) {
        String namespace = jenkins.getMetadata().getNamespace();
        String name = jenkins.getMetadata().getName();
        JenkinsMaster master = jenkins.getSpec() != null ? jenkins.getSpec().getMaster() : null;

        if (master == null || master.getImage() == null || master.getImage().isEmpty()) {
            log.warn("Image not set for Jenkins {}/{}", namespace, name);
            return false;
        }

        if (!DockerImageReference.isValid(master.getImage())) {
            log.warn("Invalid image '{}' for Jenkins {}/{}", master.getImage(), namespace, name);
            return false;
        }

        return validatePlugins(namespace, name, master);
    }

    private boolean validatePlugins(String namespace, String name, JenkinsMaster master) {
        PluginDeclarations declarations = new PluginDeclarations()
                .add(PluginOrigin.OPERATOR, master.getOperatorPlugins())
                .add(PluginOrigin.USER, master.getPlugins());

        if (declarations.hasErrors()) {
            declarations.getErrors().forEach(error ->
                    log.warn("{} for Jenkins {}/{}", error, namespace, name));
            return false;
        }

        if (!dependencyResolver.verify(declarations.getGraph())) {
            log.warn("Plugin dependencies of Jenkins {}/{} require conflicting versions", namespace, name);
            return false;
        }
        return true;
    }
}
