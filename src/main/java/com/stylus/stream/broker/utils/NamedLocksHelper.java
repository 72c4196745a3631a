package com.stylus.stream.broker.utils;

import javax.annotation.Nonnull;

public class NamedLocksHelper {
    /**
     * The one serialization domain: registry, session table and wait queues are only touched under it.
     */
    private static final String BROKER_LOCK = "BROKER";

    @Nonnull
    public static String getBrokerLockName() {
        return BROKER_LOCK;
    }
}
