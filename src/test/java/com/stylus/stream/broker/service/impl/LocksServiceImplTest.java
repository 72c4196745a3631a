package com.stylus.stream.broker.service.impl;

import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.exceptions.LockAcquiringFail;
import com.stylus.stream.broker.exceptions.StreamResolutionException;
import com.stylus.stream.broker.model.CallSpec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.stylus.stream.broker.model.Metrics.Counters.UNDER_LOCK_ERRORS;
import static com.stylus.stream.broker.model.Metrics.Tags.ERROR_TYPE;
import static com.stylus.stream.broker.utils.NamedLocksHelper.getBrokerLockName;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocksServiceImplTest {
    private SimpleMeterRegistry meterRegistry;
    private LocksServiceImpl locksService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        locksService = new LocksServiceImpl(meterRegistry);
    }

    @Test
    void shouldRunActionAndRecordTimers() throws Exception {
        String result = locksService.doUnderLock(CallSpec.<String>builder()
                .lockNames(ImmutableList.of(getBrokerLockName()))
                .action(() -> "done")
                .waitTimeMs(100)
                .outsideTimer(meterRegistry.timer("outside"))
                .insideTimer(meterRegistry.timer("inside"))
                .build());

        assertEquals("done", result);
        assertEquals(1, meterRegistry.timer("outside").count());
        assertEquals(1, meterRegistry.timer("inside").count());
    }

    @Test
    void shouldFailFastWhenLockIsHeldElsewhere() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch unlock = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Object> holder = executor.submit(() -> locksService.doUnderLock(CallSpec.builder()
                    .lockNames(ImmutableList.of(getBrokerLockName()))
                    .action(() -> {
                        locked.countDown();
                        return unlock.await(5, TimeUnit.SECONDS);
                    })
                    .waitTimeMs(100)
                    .build()));
            locked.await(5, TimeUnit.SECONDS);

            assertThrows(LockAcquiringFail.class, () -> locksService.doUnderLock(CallSpec.<String>builder()
                    .lockNames(ImmutableList.of(getBrokerLockName()))
                    .action(() -> "never")
                    .waitTimeMs(50)
                    .build()));
            assertEquals(1.0, meterRegistry.get(UNDER_LOCK_ERRORS).tag(ERROR_TYPE, "try_lock_fail").counter().count());

            unlock.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            unlock.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldPropagateActionFailureAndReleaseLock() throws Exception {
        assertThrows(StreamResolutionException.class, () -> locksService.doUnderLock(CallSpec.<String>builder()
                .lockNames(ImmutableList.of(getBrokerLockName()))
                .action(() -> {
                    throw new StreamResolutionException("boom");
                })
                .waitTimeMs(100)
                .build()));

        assertEquals("free", locksService.doUnderLock(CallSpec.<String>builder()
                .lockNames(ImmutableList.of(getBrokerLockName()))
                .action(() -> "free")
                .waitTimeMs(0)
                .build()));
    }
}
