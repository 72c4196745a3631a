package com.stylus.stream.broker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Notification for the playback side. Built inside the broker lock, dispatched after it is released.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionEvent {
    @NonNull
    SessionEventType type;
    @Nullable
    StreamSession session;
    @Nullable
    QueueEntry queueEntry;
    @Nullable
    SessionEndReason reason;
    long timestamp;

    public boolean isRetryable() {
        return reason != null && reason.isRetryable();
    }

    public long durationMs() {
        return session == null ? 0L : Math.max(0L, timestamp - session.getStartedAt());
    }
}
