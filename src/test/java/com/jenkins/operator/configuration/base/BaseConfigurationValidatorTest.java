package com.jenkins.operator.configuration.base;

import com.jenkins.operator.JenkinsFixtures;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsMaster;
import com.jenkins.operator.plugins.PluginDependencyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BaseConfigurationValidatorTest {

    private BaseConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new BaseConfigurationValidator(new PluginDependencyResolver());
    }

    @Test
    void testValidateCompleteMaster() {
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(), null);

        assertThat(validator.validate(jenkins)).isTrue();
    }

    @Test
    void testValidateEmptyImage() {
        // Given
        JenkinsMaster master = JenkinsFixtures.completeMaster();
        master.setImage("");

        // When / Then
        assertThat(validator.validate(JenkinsFixtures.jenkins(master, null))).isFalse();
    }

    @Test
    void testValidateMissingMaster() {
        assertThat(validator.validate(JenkinsFixtures.jenkins(null, null))).isFalse();
    }

    @Test
    void testValidateInvalidImage() {
        // Given
        JenkinsMaster master = JenkinsFixtures.completeMaster();
        master.setImage("Jenkins/Jenkins:lts");

        // When / Then
        assertThat(validator.validate(JenkinsFixtures.jenkins(master, null))).isFalse();
    }

    @Test
    void testValidateInvalidPluginToken() {
        // Given
        JenkinsMaster master = JenkinsFixtures.completeMaster();
        Map<String, List<String>> plugins = new HashMap<>();
        plugins.put("simple-theme-plugin", List.of());
        master.setPlugins(plugins);

        // When / Then
        assertThat(validator.validate(JenkinsFixtures.jenkins(master, null))).isFalse();
    }

    @Test
    void testValidateUserPluginConflictingWithOperatorPlugin() {
        // Given
        JenkinsMaster master = JenkinsFixtures.completeMaster();
        Map<String, List<String>> plugins = new HashMap<>();
        plugins.put("blueocean:1.9.0", List.of("structs:1.14"));
        master.setPlugins(plugins);

        // When / Then
        assertThat(validator.validate(JenkinsFixtures.jenkins(master, null))).isFalse();
    }

    @Test
    void testValidateIsRepeatable() {
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(), null);

        assertThat(validator.validate(jenkins)).isEqualTo(validator.validate(jenkins));
    }
}
