package com.stylus.stream.broker.service.impl;

import com.google.common.collect.ImmutableMap;
import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.service.StreamUrlResolver;
import com.stylus.stream.broker.service.StreamUrlResolverManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.List;

import static java.lang.String.format;

@Slf4j
@Service
public class StreamUrlResolverManagerImpl implements StreamUrlResolverManager {

    private final ImmutableMap<ResourceKind, StreamUrlResolver> resolverByKind;

    public StreamUrlResolverManagerImpl(@Nonnull List<StreamUrlResolver> resolvers) {
        ImmutableMap.Builder<ResourceKind, StreamUrlResolver> builder = ImmutableMap.builder();
        resolvers.forEach(resolver -> builder.put(resolver.resourceKind(), resolver));
        this.resolverByKind = builder.build();
    }

    @Nonnull
    @Override
    public StreamUrlResolver getResolver(@Nonnull ResourceKind resourceKind) {
        StreamUrlResolver result = resolverByKind.get(resourceKind);
        if (result == null) {
            log.error("Unsupported resource kind=[{}]", resourceKind);
            throw new IllegalStateException(format("Unsupported resource kind=[%s]", resourceKind));
        }
        return result;
    }
}
