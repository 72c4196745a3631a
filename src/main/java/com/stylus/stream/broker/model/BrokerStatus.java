package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BrokerStatus {
    List<TunerView> tuners;
    List<CredentialSlotView> credentials;
    List<StreamSession> activeSessions;
    int queueLength;
    Map<String, Integer> queues;
    /**
     * channel key -> tuner id for every busy tuner
     */
    Map<String, Integer> channelMapping;
}
