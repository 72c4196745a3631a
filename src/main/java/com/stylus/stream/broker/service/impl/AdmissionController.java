package com.stylus.stream.broker.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.dao.CredentialSlotDao;
import com.stylus.stream.broker.dao.SessionDao;
import com.stylus.stream.broker.dao.TunerDao;
import com.stylus.stream.broker.dao.WaitQueueDao;
import com.stylus.stream.broker.exceptions.InvalidChannelException;
import com.stylus.stream.broker.exceptions.NoCapacityConfiguredException;
import com.stylus.stream.broker.exceptions.QueueTicketNotFoundException;
import com.stylus.stream.broker.exceptions.SessionNotFoundException;
import com.stylus.stream.broker.exceptions.SessionOwnershipException;
import com.stylus.stream.broker.exceptions.StreamUnavailableException;
import com.stylus.stream.broker.model.*;
import com.stylus.stream.broker.utils.ChannelKeys;
import com.stylus.stream.broker.utils.SessionTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.stylus.stream.broker.utils.QueuePoolsHelper.TUNER_POOL;
import static com.stylus.stream.broker.utils.QueuePoolsHelper.getCredentialPoolName;
import static com.stylus.stream.broker.utils.QueuePoolsHelper.getPoolName;

/**
 * Allocation and reclamation decisions over the resource registry, session table and wait queues.
 * <p>
 * IMPORTANT: every method must be called under the broker lock, see {@link BrokerServiceImpl}.
 * Nothing here does I/O: urls that still have to be resolved and events for the playback side are
 * collected into {@link AdmissionEffects}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionController {
    static final Pair<String, Integer> DEFAULT_PRIORITY = Pair.of("broker.queue.default.priority", 0);
    static final Pair<String, Integer> MAX_TUNER_FAILURES = Pair.of("broker.tuner.max.failures", 3);

    private final TunerDao tunerDao;
    private final CredentialSlotDao credentialSlotDao;
    private final SessionDao sessionDao;
    private final WaitQueueDao waitQueueDao;
    private final ConfigurationService configurationService;
    private final Clock clock;

    @Nonnull
    public AdmissionResult requestChannel(@Nonnull ChannelRequest request,
                                          @Nonnull AdmissionEffects effects)
            throws NoCapacityConfiguredException, InvalidChannelException, StreamUnavailableException {
        ResourceKind resourceKind = request.getResourceKind() == null ? ResourceKind.TUNER : request.getResourceKind();
        validate(request, resourceKind);

        String userId = request.getUserId();
        String channelKey = request.getChannelKey();
        if (resourceKind == ResourceKind.CREDENTIAL) {
            // a provider login is too scarce to hold twice for the same viewer and stream
            StreamSession existing = sessionDao.findByUserAndChannel(userId, channelKey, resourceKind);
            if (existing != null) {
                if (!existing.isResolved()) {
                    throw new StreamUnavailableException(String.format("stream [%s] of user %s is still resolving, try again", channelKey, userId));
                }
                touch(existing);
                log.info("user {} already watches {} on credential {}, reusing session", userId, channelKey, existing.getResourceId());
                return AdmissionResult.granted(AdmissionResult.Outcome.EXISTING, existing);
            }
        }

        String pool = getPoolName(resourceKind, request.getProviderId());
        QueueEntry alreadyQueued = waitQueueDao.findByUserAndChannel(pool, userId, channelKey);
        if (alreadyQueued != null) {
            return AdmissionResult.queued(alreadyQueued.getTicketId(), waitQueueDao.position(alreadyQueued.getTicketId()));
        }

        ChannelRequest allocation = ChannelRequest.builder()
                .userId(userId)
                .channelKey(channelKey)
                .resourceKind(resourceKind)
                .providerId(StringUtils.trimToNull(request.getProviderId()))
                .priority(request.getPriority() == null ? configurationService.getInt(DEFAULT_PRIORITY) : request.getPriority())
                .deviceType(request.getDeviceType())
                .ipAddress(request.getIpAddress())
                .build();

        Tuner sharedTuner = resourceKind == ResourceKind.TUNER ? tunerDao.findTunedTo(channelKey) : null;
        StreamSession session = tryAllocate(allocation, effects);
        if (session != null) {
            effects.addEvent(event(SessionEventType.GRANTED, session, null, null));
            return AdmissionResult.granted(sharedTuner != null ? AdmissionResult.Outcome.SHARED : AdmissionResult.Outcome.ALLOCATED, session);
        }

        QueueEntry entry = QueueEntry.builder()
                .ticketId(SessionTokens.newToken())
                .userId(userId)
                .channelKey(channelKey)
                .resourceKind(resourceKind)
                .providerId(allocation.getProviderId())
                .requestedAt(clock.millis())
                .priority(allocation.getPriority())
                .sequence(waitQueueDao.nextSequence())
                .deviceType(allocation.getDeviceType())
                .ipAddress(allocation.getIpAddress())
                .build();
        int position = waitQueueDao.enqueue(pool, entry);
        log.info("no {} free for user {} channel {}, queued at position {} of {}", resourceKind, userId, channelKey, position, pool);
        return AdmissionResult.queued(entry.getTicketId(), position);
    }

    private void validate(@Nonnull ChannelRequest request, @Nonnull ResourceKind resourceKind) throws InvalidChannelException, NoCapacityConfiguredException {
        if (StringUtils.isBlank(request.getUserId())) {
            throw new IllegalArgumentException("empty user id");
        }
        if (resourceKind == ResourceKind.UNKNOWN) {
            throw new IllegalArgumentException("unknown resource kind");
        }
        if (!ChannelKeys.isValid(request.getChannelKey(), resourceKind)) {
            throw new InvalidChannelException(String.format("malformed %s channel key [%s]", resourceKind, request.getChannelKey()));
        }
        if (resourceKind == ResourceKind.TUNER && tunerDao.size() == 0) {
            throw new NoCapacityConfiguredException("no tuners configured");
        }
        if (resourceKind == ResourceKind.CREDENTIAL && !credentialSlotDao.hasProvider(request.getProviderId())) {
            throw new NoCapacityConfiguredException(StringUtils.isBlank(request.getProviderId())
                    ? "no provider credentials configured"
                    : "no credentials configured for provider " + request.getProviderId());
        }
    }

    /**
     * Shares a tuner already tuned to the channel, otherwise takes free capacity.
     *
     * @return the new session, null when the request has to wait
     */
    @Nullable
    private StreamSession tryAllocate(@Nonnull ChannelRequest request, @Nonnull AdmissionEffects effects) {
        switch (request.getResourceKind()) {
            case TUNER:
                Tuner tuner = tunerDao.findTunedTo(request.getChannelKey());
                if (tuner == null) {
                    tuner = tunerDao.findAvailable();
                    if (tuner == null) {
                        return null;
                    }
                    tuner.setStatus(TunerStatus.BUSY);
                    tuner.setTunedChannel(request.getChannelKey());
                    log.info("tuner {} tuned to channel {}", tuner.getId(), request.getChannelKey());
                }
                return attachToTuner(tuner, request, effects);
            case CREDENTIAL:
                CredentialSlot slot = credentialSlotDao.findMostSpare(request.getProviderId());
                if (slot == null) {
                    return null;
                }
                slot.setActiveConnections(slot.getActiveConnections() + 1);
                StreamSession session = newSession(request, ResourceKind.CREDENTIAL, slot.getId());
                effects.requireResolution(target(session, slot.copy()));
                log.info("credential {} of provider {} granted to user {} for stream {}, connections {}/{}",
                        slot.getId(), slot.getProviderId(), request.getUserId(), request.getChannelKey(),
                        slot.getActiveConnections(), slot.getMaxConnections());
                return session;
            default:
                throw new IllegalStateException("unsupported resource kind " + request.getResourceKind());
        }
    }

    @Nonnull
    private StreamSession attachToTuner(@Nonnull Tuner tuner, @Nonnull ChannelRequest request, @Nonnull AdmissionEffects effects) {
        String riderUrl = tuner.getSessionIds().stream()
                .map(sessionDao::getSession)
                .filter(Objects::nonNull)
                .map(StreamSession::getStreamUrl)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        StreamSession session = newSession(request, ResourceKind.TUNER, tuner.getId());
        tuner.getSessionIds().add(session.getSessionId());
        tuner.setLastActivity(clock.millis());
        if (riderUrl != null) {
            session.setStreamUrl(riderUrl);
        } else {
            effects.requireResolution(target(session, null));
        }
        log.info("user {} attached to tuner {} channel {}, riders {}", request.getUserId(), tuner.getId(),
                request.getChannelKey(), tuner.getSessionIds().size());
        return session;
    }

    @Nonnull
    private StreamSession newSession(@Nonnull ChannelRequest request, @Nonnull ResourceKind resourceKind, int resourceId) {
        long now = clock.millis();
        StreamSession session = StreamSession.builder()
                .sessionId(SessionTokens.newToken())
                .resourceKind(resourceKind)
                .resourceId(resourceId)
                .channelKey(request.getChannelKey())
                .userId(request.getUserId())
                .startedAt(now)
                .lastHeartbeat(now)
                .priority(request.getPriority())
                .deviceType(request.getDeviceType())
                .ipAddress(request.getIpAddress())
                .build();
        sessionDao.save(session);
        return session;
    }

    /**
     * Idempotent: an unknown or already released session is ignored.
     *
     * @return whether a session was released
     */
    public boolean releaseSession(@Nonnull String sessionId, @Nonnull SessionEndReason reason, @Nonnull AdmissionEffects effects) {
        StreamSession session = sessionDao.remove(sessionId);
        if (session == null) {
            return false;
        }
        waitQueueDao.forgetGrantOf(sessionId);
        effects.addEvent(event(SessionEventType.ENDED, session, null, reason));
        log.info("session {} of user {} on {} {} channel {} ended: {}", abbreviate(sessionId), session.getUserId(),
                session.getResourceKind(), session.getResourceId(), session.getChannelKey(), reason);

        switch (session.getResourceKind()) {
            case TUNER:
                Tuner tuner = tunerDao.getTuner(session.getResourceId());
                if (tuner == null) {
                    break;
                }
                tuner.getSessionIds().remove(sessionId);
                tuner.setLastActivity(clock.millis());
                if (tuner.getSessionIds().isEmpty() && tuner.getStatus() == TunerStatus.BUSY) {
                    tuner.setStatus(TunerStatus.AVAILABLE);
                    tuner.setTunedChannel(null);
                    log.info("tuner {} released", tuner.getId());
                    promote(ImmutableList.of(TUNER_POOL), effects);
                }
                break;
            case CREDENTIAL:
                CredentialSlot slot = credentialSlotDao.getSlot(session.getResourceId());
                if (slot == null) {
                    break;
                }
                slot.setActiveConnections(Math.max(0, slot.getActiveConnections() - 1));
                promote(ImmutableList.of(getCredentialPoolName(slot.getProviderId()), getCredentialPoolName(null)), effects);
                break;
            default:
                break;
        }
        return true;
    }

    /**
     * Release requested through the API. A blank user id skips the ownership check.
     */
    public boolean releaseOwnSession(@Nonnull String sessionId, @Nullable String userId, @Nonnull AdmissionEffects effects)
            throws SessionOwnershipException {
        StreamSession session = sessionDao.getSession(sessionId);
        if (session != null && StringUtils.isNotBlank(userId) && !userId.equals(session.getUserId())) {
            log.warn("user {} tried to release session {} of user {}", userId, abbreviate(sessionId), session.getUserId());
            throw new SessionOwnershipException(sessionId, userId);
        }
        return releaseSession(sessionId, SessionEndReason.RELEASED, effects);
    }

    /**
     * Serves queue heads of the given pools, best (priority, arrival) first, while capacity lasts.
     */
    private void promote(@Nonnull List<String> pools, @Nonnull AdmissionEffects effects) {
        boolean promoted = true;
        while (promoted) {
            promoted = false;
            List<QueueEntry> heads = pools.stream()
                    .map(waitQueueDao::peek)
                    .filter(Objects::nonNull)
                    .sorted(QueueEntry.SERVE_ORDER)
                    .collect(Collectors.toList());
            for (QueueEntry head : heads) {
                StreamSession session = tryAllocate(head.toRequest(), effects);
                if (session != null) {
                    onPromoted(head, session, effects);
                    if (head.getResourceKind() == ResourceKind.TUNER) {
                        attachWaitingViewers(head.getChannelKey(), effects);
                    }
                    promoted = true;
                    break;
                }
            }
        }
    }

    /**
     * Once a channel is tuned, every queued viewer of that channel can ride along without contending for capacity.
     */
    private void attachWaitingViewers(@Nonnull String channelKey, @Nonnull AdmissionEffects effects) {
        Tuner tuner = tunerDao.findTunedTo(channelKey);
        if (tuner == null) {
            return;
        }
        for (QueueEntry entry : waitQueueDao.getEntries(TUNER_POOL)) {
            if (channelKey.equals(entry.getChannelKey())) {
                onPromoted(entry, attachToTuner(tuner, entry.toRequest(), effects), effects);
            }
        }
    }

    private void onPromoted(@Nonnull QueueEntry entry, @Nonnull StreamSession session, @Nonnull AdmissionEffects effects) {
        waitQueueDao.remove(entry.getTicketId());
        waitQueueDao.recordGrant(entry.getTicketId(), session.getSessionId());
        effects.addEvent(event(SessionEventType.PROMOTED, session, entry, null));
        log.info("queued request of user {} for {} promoted after {} ms", entry.getUserId(), entry.getChannelKey(),
                clock.millis() - entry.getRequestedAt());
    }

    public void heartbeat(@Nonnull String sessionId) throws SessionNotFoundException {
        StreamSession session = sessionDao.getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        touch(session);
    }

    private void touch(@Nonnull StreamSession session) {
        long now = clock.millis();
        session.setLastHeartbeat(now);
        if (session.getResourceKind() == ResourceKind.TUNER) {
            Tuner tuner = tunerDao.getTuner(session.getResourceId());
            if (tuner != null) {
                tuner.setLastActivity(now);
            }
        }
    }

    /**
     * Evicts every rider with a retryable stream error. The queue is not promoted onto a failed tuner.
     */
    @Nonnull
    public TunerView markTunerFailed(int tunerId, @Nonnull AdmissionEffects effects) {
        Tuner tuner = getExistingTuner(tunerId);
        tuner.setFailureCount(tuner.getFailureCount() + 1);
        takeOutOfService(tuner, TunerStatus.FAILED, SessionEndReason.RESOURCE_FAILED, effects);
        log.warn("tuner {} marked failed, failures {}", tunerId, tuner.getFailureCount());
        return tuner.toView();
    }

    @Nonnull
    public TunerView setTunerMaintenance(int tunerId, @Nonnull AdmissionEffects effects) {
        Tuner tuner = getExistingTuner(tunerId);
        takeOutOfService(tuner, TunerStatus.MAINTENANCE, SessionEndReason.MAINTENANCE, effects);
        log.info("tuner {} put into maintenance", tunerId);
        return tuner.toView();
    }

    private void takeOutOfService(@Nonnull Tuner tuner, @Nonnull TunerStatus status, @Nonnull SessionEndReason reason,
                                  @Nonnull AdmissionEffects effects) {
        // status first, so releasing the last rider doesn't hand the tuner to the queue
        tuner.setStatus(status);
        tuner.setLastActivity(clock.millis());
        for (String sessionId : ImmutableList.copyOf(tuner.getSessionIds())) {
            releaseSession(sessionId, reason, effects);
        }
        tuner.getSessionIds().clear();
        tuner.setTunedChannel(null);
    }

    /**
     * External "recovered" signal. Returns a failed or maintained tuner to service and promotes the queue onto it.
     */
    @Nonnull
    public TunerView markTunerRecovered(int tunerId, @Nonnull AdmissionEffects effects) {
        Tuner tuner = getExistingTuner(tunerId);
        if (tuner.getStatus() != TunerStatus.FAILED && tuner.getStatus() != TunerStatus.MAINTENANCE) {
            log.info("tuner {} is {}, nothing to recover", tunerId, tuner.getStatus());
            return tuner.toView();
        }
        recover(tuner, effects);
        return tuner.toView();
    }

    private void recover(@Nonnull Tuner tuner, @Nonnull AdmissionEffects effects) {
        tuner.setStatus(TunerStatus.AVAILABLE);
        tuner.setFailureCount(0);
        tuner.setTunedChannel(null);
        tuner.setLastActivity(clock.millis());
        log.info("tuner {} back in service", tuner.getId());
        promote(ImmutableList.of(TUNER_POOL), effects);
    }

    @Nonnull
    private Tuner getExistingTuner(int tunerId) {
        Tuner tuner = tunerDao.getTuner(tunerId);
        if (tuner == null) {
            throw new IllegalArgumentException("unknown tuner " + tunerId);
        }
        return tuner;
    }

    /**
     * Stores a resolved url. A session released in the meantime is ignored.
     */
    public boolean commitStreamUrl(@Nonnull String sessionId, @Nonnull String streamUrl) {
        StreamSession session = sessionDao.getSession(sessionId);
        if (session == null) {
            return false;
        }
        if (!session.isResolved()) {
            session.setStreamUrl(streamUrl);
        }
        return true;
    }

    /**
     * Rolls back a reservation whose url couldn't be resolved. Repeated failures take the tuner out of service.
     *
     * @param countFailure false for further sessions waiting on a url that already failed in the same round
     */
    public void rollbackResolution(@Nonnull StreamTarget target, boolean countFailure, @Nonnull AdmissionEffects effects) {
        effects.markResolutionFailed(target.getSessionId());
        if (countFailure && target.getResourceKind() == ResourceKind.TUNER) {
            Tuner tuner = tunerDao.getTuner(target.getResourceId());
            if (tuner != null && tuner.getStatus() == TunerStatus.BUSY && tuner.getSessionIds().contains(target.getSessionId())) {
                tuner.setFailureCount(tuner.getFailureCount() + 1);
                if (tuner.getFailureCount() >= configurationService.getInt(MAX_TUNER_FAILURES)) {
                    tuner.setStatus(TunerStatus.FAILED);
                    releaseSession(target.getSessionId(), SessionEndReason.RESOLUTION_FAILED, effects);
                    takeOutOfService(tuner, TunerStatus.FAILED, SessionEndReason.RESOURCE_FAILED, effects);
                    log.error("tuner {} marked failed after {} failures", tuner.getId(), tuner.getFailureCount());
                    return;
                }
            }
        }
        releaseSession(target.getSessionId(), SessionEndReason.RESOLUTION_FAILED, effects);
    }

    /**
     * @return number of sessions reclaimed
     */
    public int expireStaleSessions(long staleThresholdMs, @Nonnull AdmissionEffects effects) {
        long now = clock.millis();
        List<String> stale = sessionDao.getAll().stream()
                .filter(session -> isStale(now, session.getLastHeartbeat(), staleThresholdMs))
                .map(StreamSession::getSessionId)
                .collect(Collectors.toList());
        stale.forEach(sessionId -> releaseSession(sessionId, SessionEndReason.HEARTBEAT_EXPIRED, effects));
        return stale.size();
    }

    @VisibleForTesting
    static boolean isStale(long now, long lastHeartbeat, long staleThresholdMs) {
        return now - lastHeartbeat > staleThresholdMs;
    }

    /**
     * @return entries that waited longer than the queue timeout
     */
    @Nonnull
    public List<QueueEntry> expireQueueEntries(long queueTimeoutMs, @Nonnull AdmissionEffects effects) {
        List<QueueEntry> expired = waitQueueDao.removeRequestedBefore(clock.millis() - queueTimeoutMs - 1);
        expired.forEach(entry -> {
            effects.addEvent(event(SessionEventType.QUEUE_EXPIRED, null, entry, null));
            log.info("queued request of user {} for {} timed out", entry.getUserId(), entry.getChannelKey());
        });
        return expired;
    }

    /**
     * @return ids of failed tuners idle for longer than the cooldown that were returned to service
     */
    @Nonnull
    public List<Integer> recoverCooledDownTuners(long cooldownMs, @Nonnull AdmissionEffects effects) {
        long now = clock.millis();
        List<Tuner> cooledDown = tunerDao.getAll().stream()
                .filter(tuner -> tuner.getStatus() == TunerStatus.FAILED && now - tuner.getLastActivity() > cooldownMs)
                .collect(Collectors.toList());
        cooledDown.forEach(tuner -> recover(tuner, effects));
        return cooledDown.stream().map(Tuner::getId).collect(Collectors.toList());
    }

    public boolean cancelQueued(@Nonnull String ticketId) {
        QueueEntry removed = waitQueueDao.remove(ticketId);
        if (removed != null) {
            log.info("queued request of user {} for {} withdrawn", removed.getUserId(), removed.getChannelKey());
        }
        return removed != null;
    }

    @Nonnull
    public ChannelResponse getQueueTicket(@Nonnull String ticketId) throws QueueTicketNotFoundException {
        if (waitQueueDao.getEntry(ticketId) != null) {
            return ChannelResponse.queued(ticketId, waitQueueDao.position(ticketId));
        }
        String sessionId = waitQueueDao.getGrant(ticketId);
        StreamSession session = sessionId == null ? null : sessionDao.getSession(sessionId);
        if (session == null) {
            throw new QueueTicketNotFoundException(ticketId);
        }
        return ChannelResponse.granted(session);
    }

    public int releaseUserSessions(@Nonnull String userId, @Nonnull AdmissionEffects effects) {
        List<String> sessionIds = sessionDao.getByUser(userId).stream()
                .map(StreamSession::getSessionId)
                .collect(Collectors.toList());
        sessionIds.forEach(sessionId -> releaseSession(sessionId, SessionEndReason.RELEASED, effects));
        return sessionIds.size();
    }

    public int releaseCredentialSessions(int credentialId, @Nonnull AdmissionEffects effects) {
        if (credentialSlotDao.getSlot(credentialId) == null) {
            throw new IllegalArgumentException("unknown credential " + credentialId);
        }
        List<String> sessionIds = sessionDao.getByResource(ResourceKind.CREDENTIAL, credentialId).stream()
                .map(StreamSession::getSessionId)
                .collect(Collectors.toList());
        sessionIds.forEach(sessionId -> releaseSession(sessionId, SessionEndReason.RELEASED, effects));
        return sessionIds.size();
    }

    @Nullable
    public StreamSession getSession(@Nonnull String sessionId) {
        StreamSession session = sessionDao.getSession(sessionId);
        return session == null ? null : session.copy();
    }

    @Nonnull
    public List<StreamSession> getUserSessions(@Nonnull String userId) {
        return sessionDao.getByUser(userId).stream()
                .map(StreamSession::copy)
                .collect(Collectors.toList());
    }

    @Nonnull
    public BrokerStatus getStatus() {
        return BrokerStatus.builder()
                .tuners(tunerDao.getAll().stream().map(Tuner::toView).collect(Collectors.toList()))
                .credentials(credentialSlotDao.getAll().stream().map(CredentialSlot::toView).collect(Collectors.toList()))
                .activeSessions(sessionDao.getAll().stream()
                        .map(StreamSession::copy)
                        .sorted(Comparator.comparingLong(StreamSession::getStartedAt))
                        .collect(Collectors.toList()))
                .queueLength(waitQueueDao.totalSize())
                .queues(waitQueueDao.sizes())
                .channelMapping(tunerDao.getChannelMapping())
                .build();
    }

    public int activeSessions() {
        return sessionDao.size();
    }

    public int queueLength() {
        return waitQueueDao.totalSize();
    }

    public int busyTuners() {
        return tunerDao.busyCount();
    }

    @Nonnull
    private StreamTarget target(@Nonnull StreamSession session, @Nullable CredentialSlot credential) {
        return StreamTarget.builder()
                .sessionId(session.getSessionId())
                .resourceKind(session.getResourceKind())
                .resourceId(session.getResourceId())
                .channelKey(session.getChannelKey())
                .credential(credential)
                .build();
    }

    @Nonnull
    private SessionEvent event(@Nonnull SessionEventType type, @Nullable StreamSession session,
                               @Nullable QueueEntry entry, @Nullable SessionEndReason reason) {
        return SessionEvent.builder()
                .type(type)
                .session(session == null ? null : session.copy())
                .queueEntry(entry)
                .reason(reason)
                .timestamp(clock.millis())
                .build();
    }

    @Nonnull
    private static String abbreviate(@Nonnull String token) {
        return StringUtils.left(token, 8) + "...";
    }
}
