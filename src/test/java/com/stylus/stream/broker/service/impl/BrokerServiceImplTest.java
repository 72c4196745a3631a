package com.stylus.stream.broker.service.impl;

import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.dao.TunerDao;
import com.stylus.stream.broker.dao.impl.CredentialSlotDaoImpl;
import com.stylus.stream.broker.dao.impl.SessionDaoImpl;
import com.stylus.stream.broker.dao.impl.TunerDaoImpl;
import com.stylus.stream.broker.dao.impl.WaitQueueDaoImpl;
import com.stylus.stream.broker.exceptions.LockAcquiringFail;
import com.stylus.stream.broker.exceptions.SessionOwnershipException;
import com.stylus.stream.broker.exceptions.StreamResolutionException;
import com.stylus.stream.broker.exceptions.StreamUnavailableException;
import com.stylus.stream.broker.model.*;
import com.stylus.stream.broker.service.SessionEventListener;
import com.stylus.stream.broker.service.StreamUrlResolver;
import com.stylus.stream.broker.service.StreamUrlResolverManager;
import com.stylus.stream.broker.util.TestClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static com.stylus.stream.broker.model.Metrics.Counters.CHANNEL_REQUEST;
import static com.stylus.stream.broker.model.Metrics.Counters.STREAM_RESOLUTION_ERROR;
import static com.stylus.stream.broker.model.Metrics.Gauges.ACTIVE_SESSIONS;
import static com.stylus.stream.broker.utils.NamedLocksHelper.getBrokerLockName;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BrokerServiceImplTest {
    @Mock
    private StreamUrlResolverManager streamUrlResolverManager;
    @Mock
    private StreamUrlResolver resolver;
    @Mock
    private SessionEventListener listener;

    private TestClock clock;
    private ConfigurationService configurationService;
    private SimpleMeterRegistry meterRegistry;
    private LocksServiceImpl locksService;
    private TunerDao tunerDao;
    private BrokerServiceImpl brokerService;

    @BeforeEach
    void setUp() throws Exception {
        clock = new TestClock(Clock.systemUTC());
        clock.setFixed(1_000_000L);
        configurationService = new ConfigurationService(new MockEnvironment(), "", 5000L);
        meterRegistry = new SimpleMeterRegistry();
        locksService = new LocksServiceImpl(meterRegistry);
        tunerDao = new TunerDaoImpl(2, clock.millis());
        AdmissionController admissionController = new AdmissionController(tunerDao,
                new CredentialSlotDaoImpl(ImmutableList.of(CredentialSlot.builder()
                        .id(1)
                        .providerId("acme")
                        .maxConnections(1)
                        .build())),
                new SessionDaoImpl(), new WaitQueueDaoImpl(), configurationService, clock);
        brokerService = new BrokerServiceImpl(admissionController, locksService, streamUrlResolverManager,
                ImmutableList.of(listener), configurationService, meterRegistry);
        brokerService.init();

        lenient().when(streamUrlResolverManager.getResolver(any())).thenReturn(resolver);
        lenient().when(resolver.resolve(any())).thenAnswer(invocation -> "http://tuner/auto/v" + invocation.<StreamTarget>getArgument(0).getChannelKey());
    }

    @Test
    void shouldGrantSessionWithResolvedUrl() throws Exception {
        ChannelResponse response = brokerService.requestChannel(tuner("A", "10.1"));

        assertTrue(response.isGranted());
        assertEquals("http://tuner/auto/v10.1", response.getStreamUrl());
        assertEquals(1, response.getResourceId());
        assertEquals("http://tuner/auto/v10.1", brokerService.getSession(response.getSessionId()).getStreamUrl());
        verify(listener).onSessionEvent(argThat(event -> event.getType() == SessionEventType.GRANTED));
        assertEquals(1.0, meterRegistry.get(CHANNEL_REQUEST).tag(Metrics.Tags.OUTCOME, "ALLOCATED").counter().count());
        assertEquals(1.0, meterRegistry.get(ACTIVE_SESSIONS).gauge().value());
    }

    @Test
    void shouldResolveOnceForSharedTuner() throws Exception {
        ChannelResponse first = brokerService.requestChannel(tuner("A", "10.1"));
        ChannelResponse second = brokerService.requestChannel(tuner("B", "10.1"));

        assertEquals(first.getResourceId(), second.getResourceId());
        assertEquals(first.getStreamUrl(), second.getStreamUrl());
        verify(resolver, times(1)).resolve(any());
    }

    @Test
    void shouldRollBackReservationWhenUrlCannotBeResolved() throws Exception {
        doThrow(new StreamResolutionException("device unreachable")).when(resolver).resolve(any());

        StreamUnavailableException e = assertThrows(StreamUnavailableException.class, () -> brokerService.requestChannel(tuner("A", "10.1")));
        assertTrue(e.isRetryable());

        BrokerStatus status = brokerService.getStatus();
        assertThat(status.getActiveSessions()).isEmpty();
        assertEquals(TunerStatus.AVAILABLE, status.getTuners().get(0).getStatus());
        assertEquals(1, status.getTuners().get(0).getFailureCount());
        assertEquals(1.0, meterRegistry.get(STREAM_RESOLUTION_ERROR).counter().count());
        verify(listener).onSessionEvent(argThat(event -> event.getReason() == SessionEndReason.RESOLUTION_FAILED));
    }

    @Test
    void shouldTakeTunerOutAfterRepeatedResolutionFailures() throws Exception {
        doThrow(new StreamResolutionException("no signal"))
                .doThrow(new StreamResolutionException("no signal"))
                .doThrow(new StreamResolutionException("no signal"))
                .doReturn("http://tuner2/auto/v10.1")
                .when(resolver).resolve(any());

        for (int i = 0; i < 3; ++i) {
            assertThrows(StreamUnavailableException.class, () -> brokerService.requestChannel(tuner("A", "10.1")));
        }
        assertEquals(TunerStatus.FAILED, brokerService.getStatus().getTuners().get(0).getStatus());

        ChannelResponse response = brokerService.requestChannel(tuner("A", "10.1"));
        assertEquals(2, response.getResourceId());
    }

    @Test
    void shouldResolveUrlOfPromotedRequest() throws Exception {
        ChannelResponse a = brokerService.requestChannel(tuner("A", "1.1"));
        brokerService.requestChannel(tuner("B", "2.1"));
        ChannelResponse queued = brokerService.requestChannel(tuner("C", "3.1"));
        assertEquals(ChannelResponseStatus.QUEUED, queued.getStatus());
        assertEquals(1, queued.getPosition());

        assertTrue(brokerService.releaseSession(a.getSessionId(), "A"));

        ChannelResponse granted = brokerService.getQueueTicket(queued.getTicketId());
        assertTrue(granted.isGranted());
        assertEquals("http://tuner/auto/v3.1", granted.getStreamUrl());
        verify(listener).onSessionEvent(argThat(event -> event.getType() == SessionEventType.PROMOTED));
    }

    @Test
    void shouldKeepWorkingWhenListenerFails() throws Exception {
        doThrow(new IllegalStateException("broken consumer")).when(listener).onSessionEvent(any());

        ChannelResponse response = brokerService.requestChannel(tuner("A", "10.1"));
        assertTrue(response.isGranted());
        assertTrue(brokerService.releaseSession(response.getSessionId(), null));
    }

    @Test
    void shouldRejectForeignRelease() throws Exception {
        ChannelResponse response = brokerService.requestChannel(tuner("A", "10.1"));

        assertThrows(SessionOwnershipException.class, () -> brokerService.releaseSession(response.getSessionId(), "B"));
        assertFalse(brokerService.releaseSession("unknown", "B"));
    }

    @Test
    void shouldReclaimSilentSessionsOnSweep() throws Exception {
        ChannelResponse silent = brokerService.requestChannel(tuner("A", "10.1"));
        ChannelResponse alive = brokerService.requestChannel(tuner("B", "5.1"));
        clock.advanceMillis(60_000);
        brokerService.heartbeat(alive.getSessionId());
        clock.advanceMillis(30_001);

        LivenessSweepResult result = brokerService.sweep(90_000, 300_000, 0);

        assertEquals(1, result.getExpiredSessions());
        assertEquals(0, result.getRecoveredTuners());
        assertThat(brokerService.getUserSessions("A")).isEmpty();
        assertEquals(TunerStatus.AVAILABLE, tunerDao.getTuner(silent.getResourceId()).getStatus());
        verify(listener).onSessionEvent(argThat(event -> event.getReason() == SessionEndReason.HEARTBEAT_EXPIRED));
    }

    @Test
    void shouldFailFastWhenBrokerLockIsBusy() throws Exception {
        configurationService.update(configuration -> configuration.setProperty(BrokerServiceImpl.LOCK_WAIT_TIME.getKey(), 50L));
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> locksService.doUnderLock(CallSpec.<Boolean>builder()
                    .lockNames(ImmutableList.of(getBrokerLockName()))
                    .action(() -> {
                        locked.countDown();
                        return release.await(5, TimeUnit.SECONDS);
                    })
                    .waitTimeMs(1000)
                    .build()));
            assertTrue(locked.await(5, TimeUnit.SECONDS));

            assertThrows(LockAcquiringFail.class, () -> brokerService.getStatus());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldKeepInvariantsUnderConcurrentViewers() throws Exception {
        int threads = 8;
        int rounds = 50;
        String[] channels = {"1.1", "2.1", "3.1", "4.1"};
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger violations = new AtomicInteger();
        try {
            List<Future<?>> futures = new CopyOnWriteArrayList<>();
            for (int t = 0; t < threads; ++t) {
                String userId = "user-" + t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; ++i) {
                        ChannelResponse response = brokerService.requestChannel(tuner(userId, channels[ThreadLocalRandom.current().nextInt(channels.length)]));
                        String sessionId = response.getSessionId();
                        if (!response.isGranted() && !brokerService.cancelQueued(response.getTicketId())) {
                            sessionId = brokerService.getQueueTicket(response.getTicketId()).getSessionId();
                        }
                        if (!invariantsHold(brokerService.getStatus())) {
                            violations.incrementAndGet();
                        }
                        if (sessionId != null) {
                            brokerService.heartbeat(sessionId);
                            brokerService.releaseSession(sessionId, userId);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        BrokerStatus status = brokerService.getStatus();
        assertEquals(0, violations.get());
        assertThat(status.getActiveSessions()).isEmpty();
        assertEquals(0, status.getQueueLength());
        assertTrue(status.getTuners().stream().allMatch(tuner -> tuner.getStatus() == TunerStatus.AVAILABLE));
    }

    private static boolean invariantsHold(BrokerStatus status) {
        for (TunerView tuner : status.getTuners()) {
            boolean busy = tuner.getStatus() == TunerStatus.BUSY;
            if (busy == tuner.getSessionIds().isEmpty() || busy != (tuner.getTunedChannel() != null)) {
                return false;
            }
        }
        return status.getChannelMapping().size() <= status.getTuners().size();
    }

    @Test
    void shouldAskToRetryWhileOwnCredentialStreamIsStillResolving() throws Exception {
        CountDownLatch resolving = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        doAnswer(invocation -> {
            resolving.countDown();
            resume.await(5, TimeUnit.SECONDS);
            return "http://iptv/live/viewer/secret/100.m3u8";
        }).when(resolver).resolve(any());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ChannelResponse> first = executor.submit(() -> brokerService.requestChannel(credential("A", "100")));
            assertTrue(resolving.await(5, TimeUnit.SECONDS));

            StreamUnavailableException e = assertThrows(StreamUnavailableException.class,
                    () -> brokerService.requestChannel(credential("A", "100")));
            assertTrue(e.isRetryable());

            resume.countDown();
            ChannelResponse granted = first.get(5, TimeUnit.SECONDS);
            assertTrue(granted.isGranted());

            ChannelResponse again = brokerService.requestChannel(credential("A", "100"));
            assertEquals(granted.getSessionId(), again.getSessionId());
            assertEquals("http://iptv/live/viewer/secret/100.m3u8", again.getStreamUrl());
            assertThat(brokerService.getStatus().getActiveSessions()).hasSize(1);
            assertEquals(1, brokerService.getStatus().getCredentials().get(0).getActiveConnections());
        } finally {
            resume.countDown();
            executor.shutdownNow();
        }
    }

    private static ChannelRequest tuner(String userId, String channelKey) {
        return ChannelRequest.builder()
                .userId(userId)
                .channelKey(channelKey)
                .build();
    }

    private static ChannelRequest credential(String userId, String channelKey) {
        return ChannelRequest.builder()
                .userId(userId)
                .channelKey(channelKey)
                .resourceKind(ResourceKind.CREDENTIAL)
                .build();
    }
}
