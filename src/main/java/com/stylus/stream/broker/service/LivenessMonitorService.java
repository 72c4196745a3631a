package com.stylus.stream.broker.service;

import com.stylus.stream.broker.model.LivenessSweepResult;

import javax.annotation.Nonnull;

public interface LivenessMonitorService {

    /**
     * Runs one sweep now, regardless of the schedule.
     */
    @Nonnull
    LivenessSweepResult sweepOnce();
}
