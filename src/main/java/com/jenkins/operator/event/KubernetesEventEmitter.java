package com.jenkins.operator.event;

import com.jenkins.operator.config.Constants;
import com.jenkins.operator.model.Jenkins;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.CoreV1EventList;
import io.kubernetes.client.openapi.models.V1EventSource;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * {@link EventEmitter} that records core/v1 events against the Jenkins resource.
 *
 * <p>Repeats of an event are folded into the recorded one by raising its count.
 */
@Slf4j
@Component
public class KubernetesEventEmitter implements EventEmitter {
    private final GenericKubernetesApi<CoreV1Event, CoreV1EventList> eventApi;
    private final Clock clock;

    @Autowired
    public KubernetesEventEmitter(ApiClient apiClient, Clock clock) {
        this(new GenericKubernetesApi<>(CoreV1Event.class, CoreV1EventList.class, "", "v1", "events", apiClient),
                clock);
    }

    KubernetesEventEmitter(GenericKubernetesApi<CoreV1Event, CoreV1EventList> eventApi, Clock clock) {
        this.eventApi = eventApi;
        this.clock = clock;
    }

    @Override
    public void emit(Jenkins jenkins, EventType type, Reason reason, String message) {
        V1ObjectMeta metadata = jenkins.getMetadata();
        CoreV1Event event = buildEvent(jenkins, type, reason, message);

        try {
            KubernetesApiResponse<CoreV1Event> response = eventApi.create(event);
            if (response.getHttpStatusCode() == HttpURLConnection.HTTP_CONFLICT) {
                response = increment(metadata.getNamespace(), event.getMetadata().getName());
            }
            if (!response.isSuccess()) {
                log.warn("Failed to emit event {} for Jenkins {}/{}: HTTP {}",
                        reason.getValue(), metadata.getNamespace(), metadata.getName(), response.getHttpStatusCode());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to emit event {} for Jenkins {}/{}: {}",
                    reason.getValue(), metadata.getNamespace(), metadata.getName(), e.getMessage());
        }
    }

    /**
     * Bumps the count of an event that was already recorded.
     */
    private KubernetesApiResponse<CoreV1Event> increment(String namespace, String name) {
        KubernetesApiResponse<CoreV1Event> existing = eventApi.get(namespace, name);
        if (!existing.isSuccess()) {
            return existing;
        }
        CoreV1Event event = existing.getObject();
        event.setCount(event.getCount() != null ? event.getCount() + 1 : 2);
        event.setLastTimestamp(OffsetDateTime.now(clock));
        return eventApi.update(event);
    }

    /**
     * Events with the same subject, type, reason and message share a name.
     */
    static String eventName(V1ObjectMeta metadata, EventType type, Reason reason, String message) {
        int key = Objects.hash(metadata.getUid(), type.getValue(), reason.getValue(), message);
        return String.format("%s.%08x", metadata.getName(), key);
    }

    CoreV1Event buildEvent(Jenkins jenkins, EventType type, Reason reason, String message) {
        V1ObjectMeta metadata = jenkins.getMetadata();
        OffsetDateTime now = OffsetDateTime.now(clock);

        return new CoreV1Event()
                .metadata(new V1ObjectMeta()
                        .namespace(metadata.getNamespace())
                        .name(eventName(metadata, type, reason, message)))
                .involvedObject(new V1ObjectReference()
                        .apiVersion(Constants.API_VERSION)
                        .kind(Constants.KIND)
                        .namespace(metadata.getNamespace())
                        .name(metadata.getName())
                        .uid(metadata.getUid())
                        .resourceVersion(metadata.getResourceVersion()))
                .type(type.getValue())
                .reason(reason.getValue())
                .message(message)
                .firstTimestamp(now)
                .lastTimestamp(now)
                .count(1)
                .reportingComponent(Constants.OPERATOR_NAME)
                .source(new V1EventSource().component(Constants.OPERATOR_NAME));
    }
}
