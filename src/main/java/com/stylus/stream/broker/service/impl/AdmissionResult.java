package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.model.StreamSession;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

@Value
@Builder
public class AdmissionResult {
    public enum Outcome {
        ALLOCATED,
        SHARED,
        EXISTING,
        QUEUED
    }

    @Nonnull
    Outcome outcome;
    /**
     * Snapshot of the granted session, its url may still be unresolved.
     */
    @Nullable
    StreamSession session;
    @Nullable
    String ticketId;
    int position;

    public boolean isGranted() {
        return outcome != Outcome.QUEUED;
    }

    static AdmissionResult granted(@Nonnull Outcome outcome, @Nonnull StreamSession session) {
        return AdmissionResult.builder()
                .outcome(outcome)
                .session(session.copy())
                .build();
    }

    static AdmissionResult queued(@Nonnull String ticketId, int position) {
        return AdmissionResult.builder()
                .outcome(Outcome.QUEUED)
                .ticketId(ticketId)
                .position(position)
                .build();
    }
}
