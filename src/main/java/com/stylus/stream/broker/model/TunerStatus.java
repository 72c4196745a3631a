package com.stylus.stream.broker.model;

public enum TunerStatus {
    AVAILABLE,
    BUSY,
    FAILED,
    MAINTENANCE
}
