package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;
import lombok.ToString;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * IPTV provider login with a fixed number of concurrent connections. Connections are never shared per channel.
 */
@Data
@Builder(toBuilder = true)
public class CredentialSlot {
    int id;
    @NonNull
    String providerId;
    int maxConnections;
    int activeConnections;
    @Nullable
    String serverUrl;
    @Nullable
    String username;
    @Nullable
    @ToString.Exclude
    String password;

    public int spareCapacity() {
        return maxConnections - activeConnections;
    }

    @Nonnull
    public CredentialSlot copy() {
        return toBuilder().build();
    }

    @Nonnull
    public CredentialSlotView toView() {
        return CredentialSlotView.builder()
                .id(id)
                .providerId(providerId)
                .maxConnections(maxConnections)
                .activeConnections(activeConnections)
                .build();
    }
}
