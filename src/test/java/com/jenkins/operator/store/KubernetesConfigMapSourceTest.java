package com.jenkins.operator.store;

import com.jenkins.operator.controller.ReconcileException;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1ConfigMapList;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KubernetesConfigMapSourceTest {
    private static final String NAME = "jenkins-operator-user-configuration-example";

    @Mock
    private GenericKubernetesApi<V1ConfigMap, V1ConfigMapList> configMapApi;

    private KubernetesConfigMapSource source;

    @BeforeEach
    void setUp() {
        source = new KubernetesConfigMapSource(configMapApi);
    }

    @Test
    void testGet() throws ReconcileException {
        when(configMapApi.get("ci", NAME)).thenReturn(new KubernetesApiResponse<>(
                new V1ConfigMap().data(Map.of("1-theme.groovy", "println 'theme'"))));

        assertThat(source.get("ci", NAME)).contains(Map.of("1-theme.groovy", "println 'theme'"));
    }

    @Test
    void testGetNotFound() throws ReconcileException {
        when(configMapApi.get("ci", NAME))
                .thenReturn(new KubernetesApiResponse<V1ConfigMap>(new V1Status(), 404));

        assertThat(source.get("ci", NAME)).isEmpty();
    }

    @Test
    void testGetClientFailure() {
        when(configMapApi.get("ci", NAME)).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> source.get("ci", NAME))
                .isInstanceOf(ReconcileException.class)
                .hasMessage("Failed to get config map ci/" + NAME);
    }
}
