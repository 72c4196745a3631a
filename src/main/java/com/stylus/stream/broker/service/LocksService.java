package com.stylus.stream.broker.service;

import com.stylus.stream.broker.model.CallSpec;

import javax.annotation.Nonnull;

public interface LocksService {

    <T> T doUnderLock(@Nonnull CallSpec<T> callSpec) throws Exception;
}
