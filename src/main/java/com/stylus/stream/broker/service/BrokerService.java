package com.stylus.stream.broker.service;

import com.stylus.stream.broker.exceptions.BrokerException;
import com.stylus.stream.broker.exceptions.QueueTicketNotFoundException;
import com.stylus.stream.broker.exceptions.SessionNotFoundException;
import com.stylus.stream.broker.exceptions.SessionOwnershipException;
import com.stylus.stream.broker.model.*;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

public interface BrokerService {

    /**
     * Grants a session with a playable url or queues the request.
     */
    @Nonnull
    ChannelResponse requestChannel(@Nonnull ChannelRequest request) throws BrokerException;

    void heartbeat(@Nonnull String sessionId) throws SessionNotFoundException;

    /**
     * Idempotent, unknown sessions are ignored.
     *
     * @param userId when present the session must belong to this user
     * @return whether a live session was released
     */
    boolean releaseSession(@Nonnull String sessionId, @Nullable String userId) throws SessionOwnershipException;

    int releaseUserSessions(@Nonnull String userId);

    int releaseCredentialSessions(int credentialId);

    @Nonnull
    StreamSession getSession(@Nonnull String sessionId) throws SessionNotFoundException;

    @Nonnull
    List<StreamSession> getUserSessions(@Nonnull String userId);

    @Nonnull
    ChannelResponse getQueueTicket(@Nonnull String ticketId) throws QueueTicketNotFoundException;

    boolean cancelQueued(@Nonnull String ticketId);

    @Nonnull
    BrokerStatus getStatus();

    @Nonnull
    TunerView markTunerFailed(int tunerId);

    @Nonnull
    TunerView markTunerRecovered(int tunerId);

    @Nonnull
    TunerView setTunerMaintenance(int tunerId);

    /**
     * One liveness pass: reclaims silent sessions, drops timed out queue entries and, with a positive cooldown,
     * returns failed tuners to service.
     */
    @Nonnull
    LivenessSweepResult sweep(long staleThresholdMs, long queueTimeoutMs, long failedTunerCooldownMs);
}
