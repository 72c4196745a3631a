package com.stylus.stream.broker.exceptions;

public class InvalidChannelException extends BrokerException {

    public InvalidChannelException(String message) {
        super(message);
    }
}
