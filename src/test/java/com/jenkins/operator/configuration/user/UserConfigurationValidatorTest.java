package com.jenkins.operator.configuration.user;

import com.jenkins.operator.JenkinsFixtures;
import com.jenkins.operator.controller.ReconcileException;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.SeedJob;
import com.jenkins.operator.store.SecretStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserConfigurationValidatorTest {

    private static final String SECRET = "deploy-keys";
    private static final String KEY = "ssh-privatekey";

    @Mock
    private SecretStore secretStore;

    private UserConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new UserConfigurationValidator(secretStore, new PrivateKeyValidator());
    }

    @Test
    void testValidateWithoutSeedJobs() throws ReconcileException {
        assertThat(validator.validate(JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(), null))).isTrue();
    }

    @Test
    void testValidateHttpsSeedJob() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.httpsSeedJob("jobs")));

        // When / Then
        assertThat(validator.validate(jenkins)).isTrue();
        verify(secretStore, never()).get(anyString(), anyString());
    }

    @Test
    void testValidateEmptyId() throws ReconcileException {
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.httpsSeedJob("")));

        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateSshSeedJobWithoutPrivateKey() throws ReconcileException {
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", null, null)));

        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateMissingSecret() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET)).thenReturn(Optional.empty());

        // When / Then
        assertThat(validator.validate(jenkins)).isFalse();
        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateKeyMissingFromSecret() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET))
                .thenReturn(Optional.of(Map.of("other", new byte[]{1})));

        // When / Then
        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateInvalidPrivateKey() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET))
                .thenReturn(Optional.of(Map.of(KEY, "not a key".getBytes(StandardCharsets.UTF_8))));

        // When / Then
        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateValidPrivateKey() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET))
                .thenReturn(Optional.of(Map.of(KEY, RsaKeyFixtures.pkcs1Pem().getBytes(StandardCharsets.UTF_8))));

        // When / Then
        assertThat(validator.validate(jenkins)).isTrue();
    }

    @Test
    void testValidateChecksEverySeedJob() throws ReconcileException {
        // Given
        SeedJob broken = JenkinsFixtures.sshSeedJob("", SECRET, KEY);
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.httpsSeedJob(""), broken));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET)).thenReturn(Optional.empty());

        // When
        boolean valid = validator.validate(jenkins);

        // Then
        assertThat(valid).isFalse();
        verify(secretStore).get(JenkinsFixtures.NAMESPACE, SECRET);
    }

    @Test
    void testValidatePropagatesStoreFailure() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                List.of(JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET))
                .thenThrow(new ReconcileException("Failed to get secret ci/deploy-keys"));

        // When / Then
        assertThatThrownBy(() -> validator.validate(jenkins))
                .isInstanceOf(ReconcileException.class)
                .hasMessage("Failed to get secret ci/deploy-keys");
    }

    @Test
    void testValidateNullSeedJobEntry() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(),
                Arrays.asList(null, JenkinsFixtures.httpsSeedJob("jobs")));

        // When / Then
        assertThat(validator.validate(jenkins)).isFalse();
    }

    @Test
    void testValidateIsRepeatable() throws ReconcileException {
        // Given
        Jenkins jenkins = JenkinsFixtures.jenkins(JenkinsFixtures.completeMaster(), List.of(
                JenkinsFixtures.sshSeedJob("jobs", SECRET, KEY),
                JenkinsFixtures.sshSeedJob("broken", "missing-keys", KEY)));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, SECRET))
                .thenReturn(Optional.of(Map.of(KEY, RsaKeyFixtures.pkcs1Pem().getBytes(StandardCharsets.UTF_8))));
        when(secretStore.get(JenkinsFixtures.NAMESPACE, "missing-keys")).thenReturn(Optional.empty());

        // When
        boolean first = validator.validate(jenkins);
        boolean second = validator.validate(jenkins);

        // Then
        assertThat(first).isFalse();
        assertThat(second).isEqualTo(first);
        verify(secretStore, times(2)).get(JenkinsFixtures.NAMESPACE, SECRET);
    }
}
