package com.stylus.stream.broker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LivenessSweepResult {
    int expiredSessions;
    int expiredQueueEntries;
    int recoveredTuners;

    public boolean isEmpty() {
        return expiredSessions == 0 && expiredQueueEntries == 0 && recoveredTuners == 0;
    }
}
