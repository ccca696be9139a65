package com.jenkins.operator.configuration.base;

import java.util.regex.Pattern;

/**
 * Container image reference grammar.
 *
 * <p>A reference is valid if it is a bare tag-like token, or a full reference of the form
 * {@code [domain[:port]/]path[:tag][@digest]}.
 */
final class DockerImageReference {
    private static final String ALPHA_NUMERIC = "[a-z0-9]+";
    private static final String SEPARATOR = "(?:[._]|__|-+)";
    private static final String NAME_COMPONENT = ALPHA_NUMERIC + "(?:" + SEPARATOR + ALPHA_NUMERIC + ")*";
    private static final String DOMAIN_COMPONENT = "(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])";
    private static final String DOMAIN = DOMAIN_COMPONENT + "(?:\\." + DOMAIN_COMPONENT + ")*(?::[0-9]+)?";
    private static final String TAG = "[\\w][\\w.-]{0,127}";
    private static final String DIGEST = "[A-Za-z][A-Za-z0-9]*(?:[-_+.][A-Za-z][A-Za-z0-9]*)*:[0-9a-fA-F]{32,}";
    private static final String NAME = "(?:" + DOMAIN + "/)?" + NAME_COMPONENT + "(?:/" + NAME_COMPONENT + ")*";

    static final Pattern TAG_PATTERN = Pattern.compile("^" + TAG + "$");
    static final Pattern REFERENCE_PATTERN =
            Pattern.compile("^(" + NAME + ")(?::(" + TAG + "))?(?:@(" + DIGEST + "))?$");

    private DockerImageReference() {
    }

    static boolean isValid(String image) {
        return TAG_PATTERN.matcher(image).matches() || REFERENCE_PATTERN.matcher(image).matches();
    }
}
