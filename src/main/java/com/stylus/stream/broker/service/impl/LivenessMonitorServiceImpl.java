package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.model.LivenessSweepResult;
import com.stylus.stream.broker.service.BrokerService;
import com.stylus.stream.broker.service.LivenessMonitorService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.stylus.stream.broker.model.Metrics.Counters.LIVENESS_SWEEP_FAIL;
import static com.stylus.stream.broker.model.Metrics.Counters.LIVENESS_SWEEP_OK;
import static com.stylus.stream.broker.model.Metrics.Tags.ERROR_TYPE;

/**
 * Periodically reclaims sessions whose viewer stopped sending heartbeats and drops queue entries nobody waits for.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LivenessMonitorServiceImpl implements LivenessMonitorService {
    static final Pair<String, Boolean> IS_LIVENESS_ENABLED = Pair.of("broker.liveness.enabled", true);
    static final Pair<String, Long> LIVENESS_PERIOD_MS = Pair.of("broker.liveness.period.ms", 30_000L);
    static final Pair<String, Long> STALE_THRESHOLD_MS = Pair.of("broker.session.stale.threshold.ms", 90_000L);
    static final Pair<String, Long> QUEUE_TIMEOUT_MS = Pair.of("broker.queue.timeout.ms", 300_000L);
    static final Pair<String, Long> FAILED_TUNER_COOLDOWN_MS = Pair.of("broker.tuner.failed.cooldown.ms", 0L);

    private final ScheduledExecutorService sweepExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("liveness-sweep-thread-%d")
            .daemon(true)
            .build());

    private final BrokerService brokerService;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        scheduleNext();
    }

    @PreDestroy
    void shutdown() {
        sweepExecutorService.shutdownNow();
    }

    void runSweep() {
        try {
            if (configurationService.getBoolean(IS_LIVENESS_ENABLED)) {
                sweepOnce();
            }
        } catch (Exception e) {
            log.error("Liveness sweep failed", e);
            meterRegistry.counter(LIVENESS_SWEEP_FAIL, Tags.of(ERROR_TYPE, e.getClass().getSimpleName())).increment();
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (sweepExecutorService.isShutdown()) {
            return;
        }
        long periodMs = configurationService.getLong(LIVENESS_PERIOD_MS);
        sweepExecutorService.schedule(this::runSweep, periodMs, TimeUnit.MILLISECONDS);
    }

    @Nonnull
    @Override
    public LivenessSweepResult sweepOnce() {
        LivenessSweepResult result = brokerService.sweep(
                configurationService.getLong(STALE_THRESHOLD_MS),
                configurationService.getLong(QUEUE_TIMEOUT_MS),
                configurationService.getLong(FAILED_TUNER_COOLDOWN_MS));
        meterRegistry.counter(LIVENESS_SWEEP_OK).increment();
        if (!result.isEmpty()) {
            log.info("liveness sweep: {} stale sessions released, {} queue entries expired, {} tuners recovered",
                    result.getExpiredSessions(), result.getExpiredQueueEntries(), result.getRecoveredTuners());
        }
        return result;
    }
}
