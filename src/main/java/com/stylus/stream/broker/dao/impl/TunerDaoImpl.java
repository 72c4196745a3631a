package com.stylus.stream.broker.dao.impl;

import com.google.common.base.Preconditions;
import com.stylus.stream.broker.dao.TunerDao;
import com.stylus.stream.broker.model.Tuner;
import com.stylus.stream.broker.model.TunerStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public class TunerDaoImpl implements TunerDao {
    private final TreeMap<Integer, Tuner> tuners = new TreeMap<>();

    /**
     * Tuners are numbered 1..count and never change afterwards.
     */
    public TunerDaoImpl(int count, long createdAt) {
        Preconditions.checkArgument(count >= 0, "tuner count must not be negative: %s", count);
        for (int id = 1; id <= count; ++id) {
            tuners.put(id, Tuner.builder()
                    .id(id)
                    .lastActivity(createdAt)
                    .build());
        }
    }

    @Nonnull
    @Override
    public Collection<Tuner> getAll() {
        return Collections.unmodifiableCollection(tuners.values());
    }

    @Nullable
    @Override
    public Tuner getTuner(int tunerId) {
        return tuners.get(tunerId);
    }

    @Nullable
    @Override
    public Tuner findTunedTo(@Nonnull String channelKey) {
        return tuners.values().stream()
                .filter(tuner -> tuner.isTunedTo(channelKey))
                .findFirst()
                .orElse(null);
    }

    @Nullable
    @Override
    public Tuner findAvailable() {
        return tuners.values().stream()
                .filter(Tuner::isAvailable)
                .findFirst()
                .orElse(null);
    }

    @Override
    public int size() {
        return tuners.size();
    }

    @Override
    public int busyCount() {
        return (int) tuners.values().stream()
                .filter(tuner -> tuner.getStatus() == TunerStatus.BUSY)
                .count();
    }

    @Nonnull
    @Override
    public Map<String, Integer> getChannelMapping() {
        Map<String, Integer> mapping = new LinkedHashMap<>();
        tuners.values().stream()
                .filter(tuner -> tuner.getStatus() == TunerStatus.BUSY && tuner.getTunedChannel() != null)
                .forEach(tuner -> mapping.put(tuner.getTunedChannel(), tuner.getId()));
        return mapping;
    }
}
