package com.stylus.stream.broker.dao.impl;

import com.stylus.stream.broker.dao.SessionDao;
import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.model.StreamSession;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class SessionDaoImpl implements SessionDao {
    private final Map<String, StreamSession> sessions = new LinkedHashMap<>();

    @Override
    public void save(@Nonnull StreamSession session) {
        sessions.put(session.getSessionId(), session);
    }

    @Nullable
    @Override
    public StreamSession getSession(@Nonnull String sessionId) {
        return sessions.get(sessionId);
    }

    @Nullable
    @Override
    public StreamSession remove(@Nonnull String sessionId) {
        return sessions.remove(sessionId);
    }

    @Nonnull
    @Override
    public Collection<StreamSession> getAll() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Nonnull
    @Override
    public List<StreamSession> getByUser(@Nonnull String userId) {
        return sessions.values().stream()
                .filter(session -> userId.equals(session.getUserId()))
                .collect(Collectors.toList());
    }

    @Nonnull
    @Override
    public List<StreamSession> getByResource(@Nonnull ResourceKind resourceKind, int resourceId) {
        return sessions.values().stream()
                .filter(session -> session.getResourceKind() == resourceKind && session.getResourceId() == resourceId)
                .collect(Collectors.toList());
    }

    @Nullable
    @Override
    public StreamSession findByUserAndChannel(@Nonnull String userId, @Nonnull String channelKey, @Nonnull ResourceKind resourceKind) {
        return sessions.values().stream()
                .filter(session -> session.getResourceKind() == resourceKind
                        && userId.equals(session.getUserId())
                        && channelKey.equals(session.getChannelKey()))
                .findFirst()
                .orElse(null);
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
