package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.model.QueueEntry;
import com.stylus.stream.broker.model.SessionEvent;
import com.stylus.stream.broker.model.StreamSession;
import com.stylus.stream.broker.service.SessionEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;

/**
 * Viewing history in the log: one line per session end with the watched duration.
 */
@Slf4j
@Service
public class LoggingSessionEventListener implements SessionEventListener {

    @Override
    public void onSessionEvent(@Nonnull SessionEvent event) {
        StreamSession session = event.getSession();
        switch (event.getType()) {
            case ENDED:
                if (session == null) {
                    return;
                }
                if (event.isRetryable()) {
                    log.warn("user {} lost channel {} on {} {} ({}), player should retry", session.getUserId(),
                            session.getChannelKey(), session.getResourceKind(), session.getResourceId(), event.getReason());
                }
                log.info("viewing ended: user={}, channel={}, resource={} {}, device={}, ip={}, duration={}s, reason={}",
                        session.getUserId(), session.getChannelKey(), session.getResourceKind(), session.getResourceId(),
                        session.getDeviceType(), session.getIpAddress(),
                        TimeUnit.MILLISECONDS.toSeconds(event.durationMs()), event.getReason());
                break;
            case QUEUE_EXPIRED:
                QueueEntry entry = event.getQueueEntry();
                if (entry != null) {
                    log.info("queue ticket of user {} for channel {} expired", entry.getUserId(), entry.getChannelKey());
                }
                break;
            default:
                if (session != null) {
                    log.debug("{}: user {} watches {} on {} {}", event.getType(), session.getUserId(), session.getChannelKey(),
                            session.getResourceKind(), session.getResourceId());
                }
                break;
        }
    }
}
