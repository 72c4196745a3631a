package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * What a stream url is resolved for. Captured under the broker lock, resolved outside of it.
 */
@Value
@Builder
public class StreamTarget {
    @NonNull
    String sessionId;
    @NonNull
    ResourceKind resourceKind;
    int resourceId;
    @NonNull
    String channelKey;
    /**
     * Copy of the login for credential sessions.
     */
    @Nullable
    CredentialSlot credential;
}
