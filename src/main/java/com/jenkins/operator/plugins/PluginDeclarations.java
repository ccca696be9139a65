package com.jenkins.operator.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges plugin declaration groups into a single dependency graph.
 *
 * <p>Every token of every group is parsed. Tokens that fail to parse are collected in
 * {@link #getErrors()} together with the group they came from, and ingestion carries on so
 * all bad tokens can be reported in one pass.
 */
public class PluginDeclarations {
    private final Map<Plugin, List<Plugin>> graph = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    /**
     * Ingests one declaration group.
     *
     * @param origin the group the declarations belong to
     * @param declarations root plugin tokens mapped to their dependent plugin tokens, may be null
     * @return this instance
     */
    public PluginDeclarations add(PluginOrigin origin, Map<String, List<String>> declarations) {
        if (declarations == null) {
            return this;
        }

        new TreeMap<>(declarations).forEach((rootToken, dependentTokens) -> {
            Plugin root = null;
            try {
                root = Plugin.parse(rootToken);
            } catch (InvalidPluginException e) {
                errors.add(String.format("Invalid root plugin name '%s' in %s: %s",
                        rootToken, origin.getFieldName(), e.getMessage()));
            }

            List<Plugin> dependents = new ArrayList<>();
            if (dependentTokens != null) {
                for (String dependentToken : dependentTokens) {
                    try {
                        dependents.add(Plugin.parse(dependentToken));
                    } catch (InvalidPluginException e) {
                        errors.add(String.format("Invalid dependent plugin name '%s' in root plugin '%s' in %s: %s",
                                dependentToken, rootToken, origin.getFieldName(), e.getMessage()));
                    }
                }
            }

            if (root != null) {
                graph.put(root, dependents);
            }
        });
        return this;
    }

    public Map<Plugin, List<Plugin>> getGraph() {
        return Collections.unmodifiableMap(graph);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
