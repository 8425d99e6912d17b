package com.streamwarden.moderation;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.PunishmentSpec;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded, per-channel history of applied punishments, newest last.
 */
public class ModerationLog {

    public record Entry(Instant at, String channelId, String userId, String userLogin,
            FilterKind kind, ModerationDecision.Tier tier, PunishmentSpec punishment, String rule) {
    }

    private final int capacity;
    private final ConcurrentHashMap<String, Deque<Entry>> channels = new ConcurrentHashMap<>();

    public ModerationLog(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void append(Entry entry) {
        Deque<Entry> queue = channels.computeIfAbsent(entry.channelId(), k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(entry);
            while (queue.size() > capacity) {
                queue.removeFirst();
            }
        }
    }

    /**
     * Up to {@code limit} most recent entries, newest first.
     */
    public List<Entry> recent(String channelId, int limit) {
        Deque<Entry> queue = channels.get(channelId);
        if (queue == null || limit <= 0) {
            return List.of();
        }
        List<Entry> result = new ArrayList<>(Math.min(limit, capacity));
        synchronized (queue) {
            Iterator<Entry> it = queue.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public List<Entry> forUser(String channelId, String userId) {
        Deque<Entry> queue = channels.get(channelId);
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            return queue.stream().filter(e -> e.userId().equals(userId)).toList();
        }
    }
}
