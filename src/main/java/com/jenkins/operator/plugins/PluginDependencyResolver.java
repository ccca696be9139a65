package com.jenkins.operator.plugins;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Verifies that a plugin dependency graph does not require two different versions of the
 * same plugin.
 *
 * <p>The graph is two levels deep: each root plugin lists the plugins it depends on. Every
 * root and every dependent is an edge requiring a version of a plugin name. Verification
 * fails when two edges target the same name with different versions.
 */
@Slf4j
@Component
public class PluginDependencyResolver {

    public boolean verify(Map<Plugin, List<Plugin>> graph) {
        Map<String, List<Requirement>> requirements = new TreeMap<>();
        graph.forEach((root, dependents) -> {
            requirements.computeIfAbsent(root.getName(), name -> new ArrayList<>())
                    .add(new Requirement(root.getVersion(), root));
            for (Plugin dependent : dependents) {
                requirements.computeIfAbsent(dependent.getName(), name -> new ArrayList<>())
                        .add(new Requirement(dependent.getVersion(), root));
            }
        });

        boolean valid = true;
        for (Map.Entry<String, List<Requirement>> entry : requirements.entrySet()) {
            List<Requirement> edges = entry.getValue();
            for (int i = 0; i < edges.size(); i++) {
                for (int j = i + 1; j < edges.size(); j++) {
                    Requirement first = edges.get(i);
                    Requirement second = edges.get(j);
                    if (!first.version.equals(second.version)) {
                        log.warn("Plugin '{}' requires version '{}' but plugin '{}' requires '{}' for plugin '{}'",
                                first.requiredBy, first.version, second.requiredBy, second.version, entry.getKey());
                        valid = false;
                    }
                }
            }
        }
        return valid;
    }

    private static final class Requirement {
        private final String version;
        private final Plugin requiredBy;

        private Requirement(String version, Plugin requiredBy) {
            this.version = version;
            this.requiredBy = requiredBy;
        }
    }
}
