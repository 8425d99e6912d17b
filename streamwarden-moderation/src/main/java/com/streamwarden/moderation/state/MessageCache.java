package com.streamwarden.moderation.state;

import com.streamwarden.moderation.ChatMessage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Recent chat messages per channel, oldest first. Feeds the one-man-spam
 * filter and the "who said this" lookup of moderators.
 * <p>
 * Each channel's queue is guarded by its own monitor. Writers go through
 * the map's per-key {@code compute} so a queue is never dropped while a
 * message is being added to it.
 */
public class MessageCache {

    public record CachedMessage(String userId, String userLogin, String text, Instant at) {
    }

    private final int maxPerChannel;
    private final ConcurrentHashMap<String, Deque<CachedMessage>> channels = new ConcurrentHashMap<>();

    public MessageCache(int maxPerChannel) {
        this.maxPerChannel = Math.max(1, maxPerChannel);
    }

    public void record(ChatMessage message, Instant at) {
        channels.compute(message.channelId(), (k, queue) -> {
            Deque<CachedMessage> q = queue != null ? queue : new ArrayDeque<>();
            synchronized (q) {
                q.addLast(new CachedMessage(message.userId(), message.userLogin(), message.text(), at));
                while (q.size() > maxPerChannel) {
                    q.removeFirst();
                }
            }
            return q;
        });
    }

    /**
     * Messages from one user in one channel at or after {@code since}.
     */
    public int countFromUserSince(String channelId, String userId, Instant since) {
        Deque<CachedMessage> queue = channels.get(channelId);
        if (queue == null) {
            return 0;
        }
        int count = 0;
        synchronized (queue) {
            Iterator<CachedMessage> it = queue.descendingIterator();
            while (it.hasNext()) {
                CachedMessage m = it.next();
                if (m.at().isBefore(since)) {
                    break;
                }
                if (m.userId().equals(userId)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Logins of users whose cached messages in the channel match the pattern,
     * in order of first match.
     */
    public List<String> usersWhoSent(String channelId, Pattern pattern) {
        Deque<CachedMessage> queue = channels.get(channelId);
        if (queue == null) {
            return List.of();
        }
        Set<String> users = new LinkedHashSet<>();
        synchronized (queue) {
            for (CachedMessage m : queue) {
                if (pattern.matcher(m.text()).find()) {
                    users.add(m.userLogin() != null ? m.userLogin() : m.userId());
                }
            }
        }
        return List.copyOf(users);
    }

    /**
     * Drop messages older than {@code cutoff}. Channels left without messages
     * are forgotten.
     *
     * @return number of messages removed
     */
    public int prune(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        for (String channelId : channels.keySet()) {
            channels.computeIfPresent(channelId, (k, queue) -> {
                synchronized (queue) {
                    while (!queue.isEmpty() && queue.peekFirst().at().isBefore(cutoff)) {
                        queue.removeFirst();
                        removed.incrementAndGet();
                    }
                    return queue.isEmpty() ? null : queue;
                }
            });
        }
        return removed.get();
    }

    public int channelCount() {
        return channels.size();
    }

    public int size(String channelId) {
        Deque<CachedMessage> queue = channels.get(channelId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.size();
        }
    }
}
