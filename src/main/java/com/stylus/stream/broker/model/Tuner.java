package com.stylus.stream.broker.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Physical tuner. Busy iff at least one session rides it, in which case it is tuned to exactly one channel.
 */
@Data
@Builder
public class Tuner {
    int id;
    @Nullable
    String tunedChannel;
    @NonNull
    @Builder.Default
    TunerStatus status = TunerStatus.AVAILABLE;
    @NonNull
    @Builder.Default
    Set<String> sessionIds = new LinkedHashSet<>();
    int failureCount;
    long lastActivity;

    public boolean isTunedTo(@Nonnull String channelKey) {
        return status == TunerStatus.BUSY && Objects.equals(tunedChannel, channelKey);
    }

    public boolean isAvailable() {
        return status == TunerStatus.AVAILABLE;
    }

    @Nonnull
    public TunerView toView() {
        return TunerView.builder()
                .id(id)
                .tunedChannel(tunedChannel)
                .status(status)
                .sessionIds(ImmutableList.copyOf(sessionIds))
                .failureCount(failureCount)
                .lastActivity(lastActivity)
                .build();
    }
}
