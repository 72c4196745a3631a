package com.stylus.stream.broker.model;

import lombok.Value;

@Value
public class ReleaseResponse {
    boolean success;
    int released;

    public static ReleaseResponse of(int released) {
        return new ReleaseResponse(true, released);
    }
}
