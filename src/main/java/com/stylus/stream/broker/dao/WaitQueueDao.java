package com.stylus.stream.broker.dao;

import com.stylus.stream.broker.model.QueueEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Priority-ordered wait queues, one per pool. Entries may be removed from any position.
 * Not thread safe: callers hold the broker lock.
 */
public interface WaitQueueDao {

    /**
     * @return 1-based position of the new entry in its pool
     */
    int enqueue(@Nonnull String pool, @Nonnull QueueEntry entry);

    /**
     * @return 1-based position of the ticket in its pool, 0 if it isn't queued
     */
    int position(@Nonnull String ticketId);

    @Nullable
    QueueEntry getEntry(@Nonnull String ticketId);

    @Nullable
    QueueEntry peek(@Nonnull String pool);

    @Nullable
    QueueEntry remove(@Nonnull String ticketId);

    @Nonnull
    List<QueueEntry> getEntries(@Nonnull String pool);

    @Nullable
    QueueEntry findByUserAndChannel(@Nonnull String pool, @Nonnull String userId, @Nonnull String channelKey);

    /**
     * Removes every entry requested at or before the cutoff.
     */
    @Nonnull
    List<QueueEntry> removeRequestedBefore(long cutoffMs);

    int size(@Nonnull String pool);

    int totalSize();

    @Nonnull
    Map<String, Integer> sizes();

    long nextSequence();

    /**
     * Remembers which session a promoted ticket became, so a polling viewer can pick up its grant.
     */
    void recordGrant(@Nonnull String ticketId, @Nonnull String sessionId);

    @Nullable
    String getGrant(@Nonnull String ticketId);

    void forgetGrantOf(@Nonnull String sessionId);
}
