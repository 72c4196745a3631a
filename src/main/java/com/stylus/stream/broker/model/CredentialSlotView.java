package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CredentialSlotView {
    int id;
    String providerId;
    int maxConnections;
    int activeConnections;
}
