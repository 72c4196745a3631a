package com.stylus.stream.broker.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

public enum ResourceKind {
    TUNER,
    CREDENTIAL,
    UNKNOWN;

    @JsonCreator
    public static ResourceKind byName(String name) {
        return Arrays.stream(ResourceKind.values())
                .filter(t -> t.name().equalsIgnoreCase(name))
                .findAny()
                .orElse(UNKNOWN);
    }
}
