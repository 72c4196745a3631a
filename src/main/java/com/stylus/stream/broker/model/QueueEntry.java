package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;

@Value
@Builder
public class QueueEntry {
    /**
     * Lower priority value is served first, then earlier request, then arrival sequence.
     */
    public static final Comparator<QueueEntry> SERVE_ORDER = Comparator
            .comparingInt(QueueEntry::getPriority)
            .thenComparingLong(QueueEntry::getRequestedAt)
            .thenComparingLong(QueueEntry::getSequence);

    @NonNull
    String ticketId;
    @NonNull
    String userId;
    @NonNull
    String channelKey;
    @NonNull
    ResourceKind resourceKind;
    @Nullable
    String providerId;
    long requestedAt;
    int priority;
    long sequence;
    @Nullable
    String deviceType;
    @Nullable
    String ipAddress;

    /**
     * Allocation inputs of the queued request, used when it is promoted.
     */
    @Nonnull
    public ChannelRequest toRequest() {
        return ChannelRequest.builder()
                .userId(userId)
                .channelKey(channelKey)
                .resourceKind(resourceKind)
                .providerId(providerId)
                .priority(priority)
                .deviceType(deviceType)
                .ipAddress(ipAddress)
                .build();
    }
}
