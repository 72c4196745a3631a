package com.stylus.stream.broker.service;

import com.stylus.stream.broker.exceptions.StreamResolutionException;
import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.model.StreamTarget;

import javax.annotation.Nonnull;

/**
 * Turns a reserved resource and channel into a playable url. May do I/O, so it is never called under the broker lock.
 */
public interface StreamUrlResolver {

    @Nonnull
    ResourceKind resourceKind();

    @Nonnull
    String resolve(@Nonnull StreamTarget target) throws StreamResolutionException;
}
