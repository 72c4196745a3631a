package com.stylus.stream.broker.model;

public enum SessionEventType {
    GRANTED,
    PROMOTED,
    ENDED,
    QUEUE_EXPIRED
}
