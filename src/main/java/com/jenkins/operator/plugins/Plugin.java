package com.jenkins.operator.plugins;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * A Jenkins plugin identified by name and version.
 */
@Value
public class Plugin {
    static final Pattern NAME_PATTERN = Pattern.compile("^[0-9a-z_-]+$");
    static final Pattern VERSION_PATTERN = Pattern.compile("^v?[0-9]++(?:[._+-]?[0-9A-Za-z]++)*+$");

    String name;
    String version;

    /**
     * Parses a {@code name:version} token. The token is split on the first colon.
     *
     * @param nameWithVersion the plugin token
     * @return the parsed plugin
     * @throws InvalidPluginException if the token, the name or the version is malformed
     */
    public static Plugin parse(String nameWithVersion) throws InvalidPluginException {
        if (nameWithVersion == null) {
            throw new InvalidPluginException("invalid plugin format 'null'");
        }
        int separator = nameWithVersion.indexOf(':');
        if (separator < 0) {
            throw new InvalidPluginException(String.format("invalid plugin format '%s'", nameWithVersion));
        }

        String name = nameWithVersion.substring(0, separator);
        String version = nameWithVersion.substring(separator + 1);
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidPluginException(String.format("invalid plugin name '%s', must follow pattern '%s'",
                    name, NAME_PATTERN.pattern()));
        }
        if (!VERSION_PATTERN.matcher(version).matches()) {
            throw new InvalidPluginException(String.format("invalid plugin version '%s' for plugin '%s'",
                    version, name));
        }
        return new Plugin(name, version);
    }

    @Override
    public String toString() {
        return name + ":" + version;
    }
}
