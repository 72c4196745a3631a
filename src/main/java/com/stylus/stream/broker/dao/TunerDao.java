package com.stylus.stream.broker.dao;

import com.stylus.stream.broker.model.Tuner;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;

/**
 * Not thread safe: callers hold the broker lock.
 */
public interface TunerDao {

    @Nonnull
    Collection<Tuner> getAll();

    @Nullable
    Tuner getTuner(int tunerId);

    /**
     * @return busy tuner already tuned to the channel, if any
     */
    @Nullable
    Tuner findTunedTo(@Nonnull String channelKey);

    /**
     * @return available tuner with the lowest id, if any
     */
    @Nullable
    Tuner findAvailable();

    int size();

    int busyCount();

    @Nonnull
    Map<String, Integer> getChannelMapping();
}
