package com.stylus.stream.broker.service.impl;

import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.exceptions.*;
import com.stylus.stream.broker.model.*;
import com.stylus.stream.broker.service.BrokerService;
import com.stylus.stream.broker.service.LocksService;
import com.stylus.stream.broker.service.SessionEventListener;
import com.stylus.stream.broker.service.StreamUrlResolverManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.PostConstruct;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static com.stylus.stream.broker.model.Metrics.Counters.*;
import static com.stylus.stream.broker.model.Metrics.Gauges.*;
import static com.stylus.stream.broker.model.Metrics.Tags.*;
import static com.stylus.stream.broker.model.Metrics.Timers.*;
import static com.stylus.stream.broker.utils.NamedLocksHelper.getBrokerLockName;

/**
 * Runs {@link AdmissionController} decisions inside the broker lock. Stream urls are resolved and events are
 * delivered after the lock is released.
 */
@Slf4j
@Service
public class BrokerServiceImpl implements BrokerService {
    static final Pair<String, Long> LOCK_WAIT_TIME = Pair.of("broker.lock.wait.time.ms", 5000L);

    private final AdmissionController admissionController;
    private final LocksService locksService;
    private final StreamUrlResolverManager streamUrlResolverManager;
    private final List<SessionEventListener> listeners;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger activeSessions = new AtomicInteger();
    private final AtomicInteger queueLength = new AtomicInteger();
    private final AtomicInteger busyTuners = new AtomicInteger();

    public BrokerServiceImpl(AdmissionController admissionController,
                             LocksService locksService,
                             StreamUrlResolverManager streamUrlResolverManager,
                             List<SessionEventListener> listeners,
                             ConfigurationService configurationService,
                             MeterRegistry meterRegistry) {
        this.admissionController = admissionController;
        this.locksService = locksService;
        this.streamUrlResolverManager = streamUrlResolverManager;
        this.listeners = ImmutableList.copyOf(listeners);
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void init() {
        meterRegistry.gauge(ACTIVE_SESSIONS, activeSessions);
        meterRegistry.gauge(QUEUE_LENGTH, queueLength);
        meterRegistry.gauge(BUSY_TUNERS, busyTuners);
    }

    @Nonnull
    @Override
    public ChannelResponse requestChannel(@Nonnull ChannelRequest request) throws BrokerException {
        String resourceKind = request.getResourceKind() == null ? ResourceKind.TUNER.name() : request.getResourceKind().name();
        AdmissionEffects effects = new AdmissionEffects();
        try {
            AdmissionResult result = execute("request_channel", effects, fx -> admissionController.requestChannel(request, fx));
            meterRegistry.counter(CHANNEL_REQUEST, Tags.of(RESOURCE_KIND, resourceKind, OUTCOME, result.getOutcome().name())).increment();
            if (!result.isGranted()) {
                return ChannelResponse.queued(Objects.requireNonNull(result.getTicketId()), result.getPosition());
            }

            String sessionId = Objects.requireNonNull(result.getSession()).getSessionId();
            settle(effects);
            if (effects.isResolutionFailed(sessionId)) {
                throw new StreamUnavailableException(String.format("no stream url for channel [%s], try again", request.getChannelKey()));
            }
            StreamSession session = execute("lookup_session", effects, fx -> admissionController.getSession(sessionId));
            if (session == null || !session.isResolved()) {
                throw new ResourceFailedException(String.format("%s %d serving channel [%s] failed, try again",
                        result.getSession().getResourceKind(), result.getSession().getResourceId(), request.getChannelKey()));
            }
            return ChannelResponse.granted(session);
        } catch (BrokerException | RuntimeException e) {
            meterRegistry.counter(CHANNEL_REQUEST_ERROR, Tags.of(RESOURCE_KIND, resourceKind, ERROR_TYPE, e.getClass().getSimpleName())).increment();
            throw e;
        } finally {
            dispatch(effects);
        }
    }

    @Override
    public void heartbeat(@Nonnull String sessionId) throws SessionNotFoundException {
        execute("heartbeat", new AdmissionEffects(), fx -> {
            admissionController.heartbeat(sessionId);
            return null;
        });
    }

    @Override
    public boolean releaseSession(@Nonnull String sessionId, @Nullable String userId) throws SessionOwnershipException {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            boolean released = execute("release_session", effects, fx -> admissionController.releaseOwnSession(sessionId, userId, fx));
            settle(effects);
            return released;
        } finally {
            dispatch(effects);
        }
    }

    @Override
    public int releaseUserSessions(@Nonnull String userId) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            int released = execute("release_user_sessions", effects, fx -> admissionController.releaseUserSessions(userId, fx));
            settle(effects);
            log.info("released {} sessions of user {}", released, userId);
            return released;
        } finally {
            dispatch(effects);
        }
    }

    @Override
    public int releaseCredentialSessions(int credentialId) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            int released = execute("release_credential_sessions", effects, fx -> admissionController.releaseCredentialSessions(credentialId, fx));
            settle(effects);
            log.info("released {} sessions of credential {}", released, credentialId);
            return released;
        } finally {
            dispatch(effects);
        }
    }

    @Nonnull
    @Override
    public StreamSession getSession(@Nonnull String sessionId) throws SessionNotFoundException {
        StreamSession session = execute("get_session", new AdmissionEffects(), fx -> admissionController.getSession(sessionId));
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    @Nonnull
    @Override
    public List<StreamSession> getUserSessions(@Nonnull String userId) {
        return execute("get_user_sessions", new AdmissionEffects(), fx -> admissionController.getUserSessions(userId));
    }

    @Nonnull
    @Override
    public ChannelResponse getQueueTicket(@Nonnull String ticketId) throws QueueTicketNotFoundException {
        return execute("get_queue_ticket", new AdmissionEffects(), fx -> admissionController.getQueueTicket(ticketId));
    }

    @Override
    public boolean cancelQueued(@Nonnull String ticketId) {
        return execute("cancel_queued", new AdmissionEffects(), fx -> admissionController.cancelQueued(ticketId));
    }

    @Nonnull
    @Override
    public BrokerStatus getStatus() {
        return execute("get_status", new AdmissionEffects(), fx -> admissionController.getStatus());
    }

    @Nonnull
    @Override
    public TunerView markTunerFailed(int tunerId) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            TunerView tuner = execute("mark_tuner_failed", effects, fx -> admissionController.markTunerFailed(tunerId, fx));
            meterRegistry.counter(TUNER_FAILED, Tags.of(REASON, "reported")).increment();
            return tuner;
        } finally {
            dispatch(effects);
        }
    }

    @Nonnull
    @Override
    public TunerView markTunerRecovered(int tunerId) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            TunerView tuner = execute("mark_tuner_recovered", effects, fx -> admissionController.markTunerRecovered(tunerId, fx));
            settle(effects);
            return tuner;
        } finally {
            dispatch(effects);
        }
    }

    @Nonnull
    @Override
    public TunerView setTunerMaintenance(int tunerId) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            return execute("set_tuner_maintenance", effects, fx -> admissionController.setTunerMaintenance(tunerId, fx));
        } finally {
            dispatch(effects);
        }
    }

    @Nonnull
    @Override
    public LivenessSweepResult sweep(long staleThresholdMs, long queueTimeoutMs, long failedTunerCooldownMs) {
        AdmissionEffects effects = new AdmissionEffects();
        try {
            LivenessSweepResult result = execute("liveness_sweep", effects, fx -> LivenessSweepResult.builder()
                    .expiredSessions(admissionController.expireStaleSessions(staleThresholdMs, fx))
                    .expiredQueueEntries(admissionController.expireQueueEntries(queueTimeoutMs, fx).size())
                    .recoveredTuners(failedTunerCooldownMs > 0 ? admissionController.recoverCooledDownTuners(failedTunerCooldownMs, fx).size() : 0)
                    .build());
            settle(effects);
            return result;
        } finally {
            dispatch(effects);
        }
    }

    /**
     * Resolves every pending stream url outside the lock, then commits or rolls back under it. Rolling back frees
     * capacity, which may promote queued requests that need urls in turn.
     */
    private void settle(@Nonnull AdmissionEffects effects) {
        Map<String, String> resolvedUrls = new HashMap<>();
        Set<String> failedTargets = new HashSet<>();
        while (effects.hasUnresolved()) {
            List<StreamTarget> targets = effects.drainUnresolved();
            Map<StreamTarget, String> urls = new LinkedHashMap<>();
            for (StreamTarget target : targets) {
                String key = resolutionKey(target);
                if (!resolvedUrls.containsKey(key) && !failedTargets.contains(key)) {
                    String url = resolve(target);
                    if (url != null) {
                        resolvedUrls.put(key, url);
                    }
                }
                urls.put(target, resolvedUrls.get(key));
            }

            execute("commit_stream_url", effects, fx -> {
                for (Map.Entry<StreamTarget, String> entry : urls.entrySet()) {
                    StreamTarget target = entry.getKey();
                    if (entry.getValue() != null) {
                        admissionController.commitStreamUrl(target.getSessionId(), entry.getValue());
                    } else {
                        admissionController.rollbackResolution(target, failedTargets.add(resolutionKey(target)), fx);
                    }
                }
                return null;
            });
        }
    }

    @Nonnull
    private static String resolutionKey(@Nonnull StreamTarget target) {
        return String.join(":", target.getResourceKind().name(), String.valueOf(target.getResourceId()), target.getChannelKey());
    }

    @Nullable
    private String resolve(@Nonnull StreamTarget target) {
        Tags tags = Tags.of(RESOURCE_KIND, target.getResourceKind().name());
        try {
            return meterRegistry.timer(STREAM_RESOLUTION_TIME, tags)
                    .recordCallable(() -> streamUrlResolverManager.getResolver(target.getResourceKind()).resolve(target));
        } catch (Exception e) {
            log.error("Can't resolve stream url for {} {} channel {}", target.getResourceKind(), target.getResourceId(), target.getChannelKey(), e);
            meterRegistry.counter(STREAM_RESOLUTION_ERROR, tags.and(ERROR_TYPE, e.getClass().getSimpleName())).increment();
            return null;
        }
    }

    private void dispatch(@Nonnull AdmissionEffects effects) {
        for (SessionEvent event : effects.drainEvents()) {
            countEvent(event);
            for (SessionEventListener listener : listeners) {
                try {
                    listener.onSessionEvent(event);
                } catch (Exception e) {
                    log.error("Listener {} failed on {} event", listener.getClass().getSimpleName(), event.getType(), e);
                }
            }
        }
    }

    private void countEvent(@Nonnull SessionEvent event) {
        switch (event.getType()) {
            case ENDED:
                String reason = event.getReason() == null ? "unknown" : event.getReason().name();
                meterRegistry.counter(SESSION_ENDED, Tags.of(REASON, reason)).increment();
                if (event.getReason() == SessionEndReason.RESOLUTION_FAILED) {
                    meterRegistry.counter(TUNER_FAILED, Tags.of(REASON, "resolution")).increment();
                }
                break;
            case PROMOTED:
                meterRegistry.counter(QUEUE_PROMOTED).increment();
                break;
            case QUEUE_EXPIRED:
                meterRegistry.counter(QUEUE_EXPIRED).increment();
                break;
            default:
                break;
        }
    }

    @SuppressWarnings("unchecked")
    private <T, E extends Exception> T execute(@Nonnull String operation,
                                               @Nonnull AdmissionEffects effects,
                                               @Nonnull BrokerAction<T, E> action) throws E {
        Tags tags = Tags.of(OPERATION, operation);
        try {
            return locksService.doUnderLock(CallSpec.<T>builder()
                    .lockNames(ImmutableList.of(getBrokerLockName()))
                    .action(() -> {
                        T result = action.apply(effects);
                        refreshGauges();
                        return result;
                    })
                    .waitTimeMs(configurationService.getLong(LOCK_WAIT_TIME))
                    .outsideTimer(meterRegistry.timer(BROKER_OUTSIDE_TIME, tags))
                    .insideTimer(meterRegistry.timer(BROKER_INSIDE_TIME, tags))
                    .build());
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            throw new IllegalStateException("interrupted while waiting for the broker lock, operation: " + operation, e);
        } catch (Exception e) {
            throw (E) e;
        }
    }

    private void refreshGauges() {
        activeSessions.set(admissionController.activeSessions());
        queueLength.set(admissionController.queueLength());
        busyTuners.set(admissionController.busyTuners());
    }

    @FunctionalInterface
    private interface BrokerAction<T, E extends Exception> {
        T apply(@Nonnull AdmissionEffects effects) throws E;
    }
}
