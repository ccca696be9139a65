package com.jenkins.operator.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Configuration for the Kubernetes client.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {
    private static final int READ_TIMEOUT_MILLIS = 60000;

    @Bean
    public ApiClient kubernetesApiClient() throws IOException {
        // Try to load from service account token first (when running in cluster)
        try {
            ApiClient client = ClientBuilder.cluster().build();
            client.setReadTimeout(READ_TIMEOUT_MILLIS);
            return client;
        } catch (IOException e) {
            // Fallback to kubeconfig file for local development
            log.info("In-cluster configuration not available ({}), falling back to kubeconfig", e.getMessage());
            String kubeConfigPath = System.getProperty("user.home") + "/.kube/config";
            try (Reader reader = new FileReader(kubeConfigPath, StandardCharsets.UTF_8)) {
                KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
                ApiClient client = ClientBuilder.kubeconfig(kubeConfig).build();
                client.setReadTimeout(READ_TIMEOUT_MILLIS);
                return client;
            }
        }
    }
}
