package com.stylus.stream.broker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelResponse {
    @NonNull
    ChannelResponseStatus status;
    @Nullable
    String sessionId;
    @Nullable
    String streamUrl;
    @Nullable
    ResourceKind resourceKind;
    @Nullable
    Integer resourceId;
    @Nullable
    String ticketId;
    /**
     * 1-based position in the wait queue, only for queued requests.
     */
    @Nullable
    Integer position;

    @Nonnull
    public static ChannelResponse granted(@Nonnull StreamSession session) {
        return ChannelResponse.builder()
                .status(ChannelResponseStatus.GRANTED)
                .sessionId(session.getSessionId())
                .streamUrl(session.getStreamUrl())
                .resourceKind(session.getResourceKind())
                .resourceId(session.getResourceId())
                .build();
    }

    @Nonnull
    public static ChannelResponse queued(@Nonnull String ticketId, int position) {
        return ChannelResponse.builder()
                .status(ChannelResponseStatus.QUEUED)
                .ticketId(ticketId)
                .position(position)
                .build();
    }

    public boolean isGranted() {
        return status == ChannelResponseStatus.GRANTED;
    }
}
