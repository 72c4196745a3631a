package com.stylus.stream.broker.service.impl;

import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.model.SessionEvent;
import com.stylus.stream.broker.model.StreamTarget;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Work produced inside the broker lock that must be carried out after the lock is released:
 * stream urls to resolve and events to deliver.
 */
public class AdmissionEffects {
    private final List<SessionEvent> events = new ArrayList<>();
    private final List<StreamTarget> unresolved = new ArrayList<>();
    private final Set<String> failedResolutions = new HashSet<>();

    void addEvent(@Nonnull SessionEvent event) {
        events.add(event);
    }

    void requireResolution(@Nonnull StreamTarget target) {
        unresolved.add(target);
    }

    void markResolutionFailed(@Nonnull String sessionId) {
        failedResolutions.add(sessionId);
    }

    public boolean isResolutionFailed(@Nonnull String sessionId) {
        return failedResolutions.contains(sessionId);
    }

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }

    /**
     * @return targets waiting for a url, the list is emptied
     */
    @Nonnull
    public List<StreamTarget> drainUnresolved() {
        List<StreamTarget> drained = ImmutableList.copyOf(unresolved);
        unresolved.clear();
        return drained;
    }

    /**
     * @return events collected so far, the list is emptied
     */
    @Nonnull
    public List<SessionEvent> drainEvents() {
        List<SessionEvent> drained = ImmutableList.copyOf(events);
        events.clear();
        return drained;
    }
}
