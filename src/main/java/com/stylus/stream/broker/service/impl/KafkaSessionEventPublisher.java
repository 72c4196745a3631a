package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.model.SessionEvent;
import com.stylus.stream.broker.model.StreamSession;
import com.stylus.stream.broker.service.SessionEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;

import static com.stylus.stream.broker.conf.CommonConfig.DEFAULT_OBJECT_MAPPER;

/**
 * Publishes session events for the playback side, keyed by user so one viewer's events stay ordered.
 */
@Slf4j
@Service
@Profile("kafka")
public class KafkaSessionEventPublisher implements SessionEventListener {
    private final String topic;
    private final KafkaTemplate<String, String> template;

    @Autowired
    public KafkaSessionEventPublisher(@Value("${session.events.kafka.topic}") String topic,
                                      KafkaTemplate<String, String> template) {
        this.topic = topic;
        this.template = template;
    }

    @Override
    public void onSessionEvent(@Nonnull SessionEvent event) throws Exception {
        String key = userOf(event);
        template.send(topic, key, DEFAULT_OBJECT_MAPPER.writeValueAsString(event));
        log.debug("published {} event of user {} to {}", event.getType(), key, topic);
    }

    @Nonnull
    private static String userOf(@Nonnull SessionEvent event) {
        StreamSession session = event.getSession();
        if (session != null) {
            return session.getUserId();
        }
        return event.getQueueEntry() != null ? event.getQueueEntry().getUserId() : "";
    }
}
