package com.stylus.stream.broker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nullable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelRequest {
    String userId;
    String channelKey;
    @Nullable
    ResourceKind resourceKind;
    /**
     * Pins a credential request to one provider's logins; any provider when absent.
     */
    @Nullable
    String providerId;
    @Nullable
    Integer priority;
    @Nullable
    String deviceType;
    @Nullable
    String ipAddress;
}
