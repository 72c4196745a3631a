package com.stylus.stream.broker.dao.impl;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import com.stylus.stream.broker.dao.WaitQueueDao;
import com.stylus.stream.broker.model.QueueEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Each pool is an ordered set, so withdrawing an entry from the middle never blocks the entries behind it.
 */
public class WaitQueueDaoImpl implements WaitQueueDao {
    private final Map<String, NavigableSet<QueueEntry>> queues = new TreeMap<>();
    private final Map<String, QueueEntry> entriesByTicket = new HashMap<>();
    private final Map<String, String> poolByTicket = new HashMap<>();
    private final BiMap<String, String> sessionByTicket = HashBiMap.create();
    private long sequence;

    @Override
    public int enqueue(@Nonnull String pool, @Nonnull QueueEntry entry) {
        if (entriesByTicket.putIfAbsent(entry.getTicketId(), entry) != null) {
            throw new IllegalStateException("ticket is already queued: " + entry.getTicketId());
        }
        poolByTicket.put(entry.getTicketId(), pool);
        NavigableSet<QueueEntry> queue = queues.computeIfAbsent(pool, p -> new TreeSet<>(QueueEntry.SERVE_ORDER));
        queue.add(entry);
        return queue.headSet(entry, false).size() + 1;
    }

    @Override
    public int position(@Nonnull String ticketId) {
        QueueEntry entry = entriesByTicket.get(ticketId);
        if (entry == null) {
            return 0;
        }
        return queues.get(poolByTicket.get(ticketId)).headSet(entry, false).size() + 1;
    }

    @Nullable
    @Override
    public QueueEntry getEntry(@Nonnull String ticketId) {
        return entriesByTicket.get(ticketId);
    }

    @Nullable
    @Override
    public QueueEntry peek(@Nonnull String pool) {
        NavigableSet<QueueEntry> queue = queues.get(pool);
        return queue == null || queue.isEmpty() ? null : queue.first();
    }

    @Nullable
    @Override
    public QueueEntry remove(@Nonnull String ticketId) {
        QueueEntry entry = entriesByTicket.remove(ticketId);
        if (entry == null) {
            return null;
        }
        String pool = poolByTicket.remove(ticketId);
        NavigableSet<QueueEntry> queue = queues.get(pool);
        queue.remove(entry);
        if (queue.isEmpty()) {
            queues.remove(pool);
        }
        return entry;
    }

    @Nonnull
    @Override
    public List<QueueEntry> getEntries(@Nonnull String pool) {
        NavigableSet<QueueEntry> queue = queues.get(pool);
        return queue == null ? ImmutableList.of() : ImmutableList.copyOf(queue);
    }

    @Nullable
    @Override
    public QueueEntry findByUserAndChannel(@Nonnull String pool, @Nonnull String userId, @Nonnull String channelKey) {
        return getEntries(pool).stream()
                .filter(entry -> userId.equals(entry.getUserId()) && channelKey.equals(entry.getChannelKey()))
                .findFirst()
                .orElse(null);
    }

    @Nonnull
    @Override
    public List<QueueEntry> removeRequestedBefore(long cutoffMs) {
        List<QueueEntry> expired = new ArrayList<>();
        for (QueueEntry entry : ImmutableList.copyOf(entriesByTicket.values())) {
            if (entry.getRequestedAt() <= cutoffMs) {
                remove(entry.getTicketId());
                expired.add(entry);
            }
        }
        expired.sort(QueueEntry.SERVE_ORDER);
        return expired;
    }

    @Override
    public int size(@Nonnull String pool) {
        NavigableSet<QueueEntry> queue = queues.get(pool);
        return queue == null ? 0 : queue.size();
    }

    @Override
    public int totalSize() {
        return entriesByTicket.size();
    }

    @Nonnull
    @Override
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        queues.forEach((pool, queue) -> sizes.put(pool, queue.size()));
        return sizes;
    }

    @Override
    public long nextSequence() {
        return ++sequence;
    }

    @Override
    public void recordGrant(@Nonnull String ticketId, @Nonnull String sessionId) {
        sessionByTicket.forcePut(ticketId, sessionId);
    }

    @Nullable
    @Override
    public String getGrant(@Nonnull String ticketId) {
        return sessionByTicket.get(ticketId);
    }

    @Override
    public void forgetGrantOf(@Nonnull String sessionId) {
        sessionByTicket.inverse().remove(sessionId);
    }
}
