package com.jenkins.operator.config;

import com.jenkins.operator.controller.JenkinsReconciler;
import com.jenkins.operator.model.Jenkins;
import com.jenkins.operator.model.JenkinsList;
import io.kubernetes.client.extended.controller.Controller;
import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.extended.controller.builder.ControllerBuilder;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration for the Kubernetes controller.
 */
@Configuration
public class ControllerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SharedInformerFactory sharedInformerFactory(ApiClient apiClient) {
        return new SharedInformerFactory(apiClient);
    }

    @Bean
    public GenericKubernetesApi<Jenkins, JenkinsList> jenkinsApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(
                Jenkins.class,
                JenkinsList.class,
                Constants.GROUP,
                Constants.VERSION,
                Constants.PLURAL,
                apiClient);
    }

    @Bean
    public SharedIndexInformer<Jenkins> jenkinsInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<Jenkins, JenkinsList> jenkinsApi) {

        return informerFactory.sharedIndexInformerFor(
                jenkinsApi,
                Jenkins.class,
                0);
    }

    @Bean
    public Controller jenkinsController(
            SharedInformerFactory informerFactory,
            JenkinsReconciler reconciler,
            SharedIndexInformer<Jenkins> jenkinsInformer,
            OperatorProperties properties) {

        return ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(Jenkins.class, workQueue)
                        .withResyncPeriod(properties.getResyncPeriod())
                        .build())
                .withWorkerCount(properties.getWorkerCount())
                .withReadyFunc(jenkinsInformer::hasSynced)
                .withReconciler(reconciler)
                .withName("JenkinsController")
                .build();
    }

    @Bean
    public ControllerManager controllerManager(
            SharedInformerFactory informerFactory,
            Controller jenkinsController) {

        return new ControllerManager(informerFactory, jenkinsController);
    }
}
