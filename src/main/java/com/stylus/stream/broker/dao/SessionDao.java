package com.stylus.stream.broker.dao;

import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.model.StreamSession;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/**
 * Not thread safe: callers hold the broker lock.
 */
public interface SessionDao {

    void save(@Nonnull StreamSession session);

    @Nullable
    StreamSession getSession(@Nonnull String sessionId);

    @Nullable
    StreamSession remove(@Nonnull String sessionId);

    @Nonnull
    Collection<StreamSession> getAll();

    @Nonnull
    List<StreamSession> getByUser(@Nonnull String userId);

    @Nonnull
    List<StreamSession> getByResource(@Nonnull ResourceKind resourceKind, int resourceId);

    @Nullable
    StreamSession findByUserAndChannel(@Nonnull String userId, @Nonnull String channelKey, @Nonnull ResourceKind resourceKind);

    int size();
}
