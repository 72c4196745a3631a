package com.stylus.stream.broker.service.impl;

import com.google.common.collect.Lists;
import com.stylus.stream.broker.exceptions.LockAcquiringFail;
import com.stylus.stream.broker.model.CallSpec;
import com.stylus.stream.broker.service.LocksService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static com.stylus.stream.broker.model.Metrics.Counters.UNDER_LOCK_ERRORS;
import static com.stylus.stream.broker.model.Metrics.Tags.ERROR_TYPE;

/**
 * In-process named locks. The broker runs as a single process, so a local lock is its whole serialization domain.
 */
@Slf4j
@Service
public class LocksServiceImpl implements LocksService {
    private final ConcurrentMap<String, Lock> locks = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    @Autowired
    public LocksServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public <T> T doUnderLock(@Nonnull CallSpec<T> callSpec) throws Exception {
        if (callSpec.getOutsideTimer() != null) {
            return callSpec.getOutsideTimer().recordCallable(() -> doUnderLocalLock(callSpec));
        }
        return doUnderLocalLock(callSpec);
    }

    private <T> T doUnderLocalLock(@Nonnull CallSpec<T> callSpec) throws Exception {
        List<Lock> namedLocks = getOrCreateLocalLocks(callSpec.getLockNames());
        List<Lock> acquiredLocks = Lists.newArrayList();
        try {
            tryAcquireLocalLocks(namedLocks, callSpec.getLockNames(), callSpec.getWaitTimeMs(), acquiredLocks);
            if (callSpec.getInsideTimer() != null) {
                return callSpec.getInsideTimer().recordCallable(callSpec.getAction());
            }
            return callSpec.getAction().call();
        } catch (InterruptedException e) {
            log.error("doUnderLocalLock(): interrupted when work under lock: {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "interrupts")).increment();
            Thread.currentThread().interrupt();
            throw e;
        } catch (LockAcquiringFail e) {
            log.warn("doUnderLocalLock(): couldn't acquire lock {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "try_lock_fail")).increment();
            throw e;
        } finally {
            releaseLocks(acquiredLocks);
        }
    }

    private void tryAcquireLocalLocks(@Nonnull List<Lock> locks,
                                      @Nonnull List<String> lockNames,
                                      long waitTimeMs,
                                      @Nonnull List<Lock> acquiredLocks) throws InterruptedException {
        for (int i = 0; i < locks.size(); ++i) {
            Lock lock = locks.get(i);
            boolean lockAcquired = lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);
            if (!lockAcquired) {
                throw new LockAcquiringFail("try_lock_fail: " + lockNames.get(i));
            }
            acquiredLocks.add(lock);
        }
    }

    private void releaseLocks(@Nonnull List<? extends Lock> locks) {
        Lists.reverse(locks).forEach(Lock::unlock);
    }

    @Nonnull
    private Lock getOrCreateLocalLock(@Nonnull String name) {
        return locks.computeIfAbsent(name, n -> new ReentrantLock());
    }

    @Nonnull
    private List<Lock> getOrCreateLocalLocks(@Nonnull List<String> lockNames) {
        return lockNames.stream().map(this::getOrCreateLocalLock).collect(Collectors.toList());
    }
}
