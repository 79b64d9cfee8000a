package ai.eigloo.workgraph.service.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer for graph audit events. Delivery settings come from {@code workgraph.events}.
 */
@Configuration
public class KafkaProducerConfig {

    @Bean(name = "graphEventProducerFactory")
    public ProducerFactory<String, String> graphEventProducerFactory(
            @Value("${spring.kafka.bootstrap-servers}") String bootstrapServers,
            WorkGraphProperties workGraphProperties) {
        WorkGraphProperties.Events events = workGraphProperties.getEvents();
        Map<String, Object> properties = new HashMap<>();
        properties.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        properties.put(ProducerConfig.CLIENT_ID_CONFIG, events.getClientId());
        properties.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        properties.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        properties.put(ProducerConfig.ACKS_CONFIG, events.getAcks());
        properties.put(ProducerConfig.RETRIES_CONFIG, events.getRetries());
        // idempotence is only valid with acks=all
        properties.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "all".equals(events.getAcks()));
        return new DefaultKafkaProducerFactory<>(properties);
    }

    @Bean(name = "graphEventKafkaTemplate")
    public KafkaTemplate<String, String> graphEventKafkaTemplate(
            ProducerFactory<String, String> graphEventProducerFactory,
            WorkGraphProperties workGraphProperties) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(graphEventProducerFactory);
        template.setDefaultTopic(workGraphProperties.getEvents().getTopic());
        return template;
    }
}
