package com.stylus.stream.broker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamSession {
    @NonNull
    String sessionId;
    @NonNull
    ResourceKind resourceKind;
    int resourceId;
    @NonNull
    String channelKey;
    @NonNull
    String userId;
    /**
     * Null until the stream url is resolved.
     */
    @Nullable
    String streamUrl;
    long startedAt;
    long lastHeartbeat;
    int priority;
    @Nullable
    String deviceType;
    @Nullable
    String ipAddress;

    public boolean isResolved() {
        return streamUrl != null;
    }

    @Nonnull
    public StreamSession copy() {
        return toBuilder().build();
    }
}
