package com.stylus.stream.broker.exceptions;

public class LockAcquiringFail extends RuntimeException {

    public LockAcquiringFail(String message) {
        super(message);
    }
}
