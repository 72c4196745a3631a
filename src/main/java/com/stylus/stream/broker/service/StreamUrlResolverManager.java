package com.stylus.stream.broker.service;

import com.stylus.stream.broker.model.ResourceKind;

import javax.annotation.Nonnull;

public interface StreamUrlResolverManager {

    @Nonnull
    StreamUrlResolver getResolver(@Nonnull ResourceKind resourceKind);
}
