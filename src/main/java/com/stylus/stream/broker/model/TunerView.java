package com.stylus.stream.broker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TunerView {
    int id;
    String tunedChannel;
    TunerStatus status;
    List<String> sessionIds;
    int failureCount;
    long lastActivity;
}
