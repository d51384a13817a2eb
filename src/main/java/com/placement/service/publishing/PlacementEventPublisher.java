package com.placement.service.publishing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.placement.model.PlacementEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.ProducerTemplate;
import org.apache.camel.component.kafka.KafkaConstants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Publishes placement change events (NEW_OFFER / UPDATE_OFFER).
 *
 * With {@code app.events.enabled=false} events are only logged. Otherwise each event is
 * sent as JSON to the {@code app.kafka.topic.placement-events} topic, keyed by company.
 * A failed send is logged and does not undo the reconciled record.
 */
@Service
@Slf4j
public class PlacementEventPublisher {

    private final ProducerTemplate producerTemplate;
    private final ObjectMapper objectMapper;
    private final boolean eventsEnabled;
    private final String endpointUri;

    public PlacementEventPublisher(
            ProducerTemplate producerTemplate,
            ObjectMapper objectMapper,
            @Value("${app.events.enabled:false}") boolean eventsEnabled,
            @Value("${app.kafka.topic.placement-events:placement-events}") String eventsTopic,
            @Value("${spring.kafka.bootstrap-servers:localhost:9092}") String bootstrapServers) {
        this.producerTemplate = producerTemplate;
        this.objectMapper = objectMapper;
        this.eventsEnabled = eventsEnabled;
        this.endpointUri = String.format("kafka:%s?brokers=%s", eventsTopic, bootstrapServers);
        log.info("PlacementEventPublisher initialized (enabled: {}, topic: {})", eventsEnabled, eventsTopic);
    }

    /**
     * @return number of events handed to the broker
     */
    public int publish(List<PlacementEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }

        if (!eventsEnabled) {
            for (PlacementEvent event : events) {
                log.info("[EVENTS DISABLED] {} for '{}' (record {}): +{} students, {} total",
                        event.type(), event.company(), event.recordId(),
                        event.newlyAddedStudents().size(), event.totalStudents());
            }
            return 0;
        }

        int sent = 0;
        for (PlacementEvent event : events) {
            try {
                String json = objectMapper.writeValueAsString(event);
                producerTemplate.sendBodyAndHeader(endpointUri, json, KafkaConstants.KEY, event.company());
                sent++;
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize {} event for '{}': {}", event.type(), event.company(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to publish {} event for '{}': {}", event.type(), event.company(), e.getMessage(), e);
            }
        }
        log.info("Published {}/{} placement events", sent, events.size());
        return sent;
    }
}
