package com.stylus.stream.broker.conf;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import javax.annotation.Nonnull;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Configuration
@Slf4j
@Profile("kafka")
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, String> sessionEventProducerFactory(KafkaProperties properties) {
        Map<String, Object> props = new HashMap<>(properties.buildProducerProperties());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, buildClientId());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> sessionEventKafkaTemplate(ProducerFactory<String, String> sessionEventProducerFactory) {
        return new KafkaTemplate<>(sessionEventProducerFactory);
    }

    @Nonnull
    protected String buildClientId() {
        String idSuffix;
        try {
            idSuffix = InetAddress.getLocalHost().getHostName();
            log.info("Resolved hostname: {}", idSuffix);
        } catch (UnknownHostException e) {
            log.error("Unable to resolve localhost host name.", e);
            idSuffix = UUID.randomUUID().toString();
        }
        String id = "stream-broker-" + idSuffix;
        log.info("Kafka client id set: {}", id);
        return id;
    }
}
