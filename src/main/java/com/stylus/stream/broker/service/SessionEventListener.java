package com.stylus.stream.broker.service;

import com.stylus.stream.broker.model.SessionEvent;

import javax.annotation.Nonnull;

/**
 * Playback side collaborator. Called outside the broker lock, after the change is committed.
 */
public interface SessionEventListener {

    void onSessionEvent(@Nonnull SessionEvent event) throws Exception;
}
