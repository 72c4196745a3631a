package com.stylus.stream.broker.controllers;

import com.stylus.stream.broker.model.ReleaseResponse;
import com.stylus.stream.broker.model.TunerView;
import com.stylus.stream.broker.service.BrokerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import javax.annotation.Nonnull;

/**
 * Operator and device-monitor signals about the resource pool.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class TunerController {
    private final BrokerService brokerService;

    @PostMapping("/tuner/{tunerId}/failed")
    @Nonnull
    public TunerView markFailed(@PathVariable int tunerId) {
        log.warn("tuner {} reported failed", tunerId);
        return brokerService.markTunerFailed(tunerId);
    }

    @PostMapping("/tuner/{tunerId}/recovered")
    @Nonnull
    public TunerView markRecovered(@PathVariable int tunerId) {
        return brokerService.markTunerRecovered(tunerId);
    }

    @PostMapping("/tuner/{tunerId}/maintenance")
    @Nonnull
    public TunerView setMaintenance(@PathVariable int tunerId) {
        return brokerService.setTunerMaintenance(tunerId);
    }

    @DeleteMapping("/credential/{credentialId}/sessions")
    @Nonnull
    public ReleaseResponse releaseCredentialSessions(@PathVariable int credentialId) {
        return ReleaseResponse.of(brokerService.releaseCredentialSessions(credentialId));
    }
}
