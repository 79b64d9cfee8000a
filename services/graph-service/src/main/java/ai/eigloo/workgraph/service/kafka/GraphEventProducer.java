package ai.eigloo.workgraph.service.kafka;

import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.service.config.WorkGraphProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes graph audit events as JSON to the configured topic, keyed by element id.
 * Send failures are logged and never reach the mutation that produced the event.
 */
@Service
public class GraphEventProducer implements GraphEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(GraphEventProducer.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final WorkGraphProperties properties;

    public GraphEventProducer(@Qualifier("graphEventKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate,
                              ObjectMapper objectMapper,
                              WorkGraphProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void publish(GraphEvent event) {
        if (!properties.getEvents().isEnabled()) {
            logger.debug("Event publishing disabled; dropping {} for {}", event.eventType().value(),
                    event.elementId());
            return;
        }
        String topic = properties.getEvents().getTopic();
        try {
            String message = objectMapper.writeValueAsString(toMessage(event));
            logger.debug("Publishing {} event to topic {}: {}", event.eventType().value(), topic, event.elementId());
            ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.elementId(), message);
            handleSendResult(kafkaTemplate.send(record), event);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} event for {}: {}", event.eventType().value(), event.elementId(),
                    e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Failed to publish {} event for {}: {}", event.eventType().value(), event.elementId(),
                    e.getMessage(), e);
        }
    }

    static Map<String, Object> toMessage(GraphEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("elementId", event.elementId());
        message.put("eventType", event.eventType().value());
        message.put("actor", event.actor());
        message.put("oldValue", event.oldValue());
        message.put("newValue", event.newValue());
        message.put("createdAt", event.createdAt().toString());
        return message;
    }

    private void handleSendResult(CompletableFuture<SendResult<String, String>> future, GraphEvent event) {
        future.whenComplete((result, throwable) -> {
            if (throwable != null) {
                logger.error("Failed to publish {} event for {}: {}", event.eventType().value(), event.elementId(),
                        throwable.getMessage());
            } else {
                logger.debug("Published {} event for {} to partition {}", event.eventType().value(),
                        event.elementId(), result.getRecordMetadata().partition());
            }
        });
    }
}
