package com.stylus.stream.broker.model;

import lombok.Value;

@Value
public class HeartbeatResponse {
    boolean success;
}
