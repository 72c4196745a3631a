package com.stylus.stream.broker.exceptions;

public class NoCapacityConfiguredException extends BrokerException {

    public NoCapacityConfiguredException(String message) {
        super(message);
    }
}
