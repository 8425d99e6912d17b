package com.streamwarden.moderation.state;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last warning per (channel, user). One warning is shared by every filter of
 * the channel.
 * <p>
 * {@link #escalate} is a single atomic read-and-record per key, so two
 * concurrent triggers for the same user produce exactly one warning. A
 * warning is always measured against the window the caller passes in, i.e.
 * the policy in force when the filter fires. The longest window an entry was
 * checked with only decides when {@link #prune} may drop it.
 */
public class WarningStateTracker {

    public enum Tier {
        /** No warning inside the window; a warning was recorded now. */
        WARNING,
        /** A warning was recorded inside the window. */
        REPEAT
    }

    private record Key(String channelId, String userId) {
    }

    private record WarningState(Instant lastWarningAt, Duration longestWindow) {
        boolean activeAt(Instant now, Duration window) {
            return !now.isAfter(lastWarningAt.plus(window));
        }

        WarningState widen(Duration window) {
            return window.compareTo(longestWindow) > 0 ? new WarningState(lastWarningAt, window) : this;
        }
    }

    private final ConcurrentHashMap<Key, WarningState> states = new ConcurrentHashMap<>();
    private final Duration minimumRetention;

    public WarningStateTracker() {
        this(Duration.ZERO);
    }

    /**
     * @param minimumRetention warnings are kept at least this long, so a
     *                         channel that widens its window after a warning
     *                         still finds it
     */
    public WarningStateTracker(Duration minimumRetention) {
        this.minimumRetention = minimumRetention == null || minimumRetention.isNegative()
                ? Duration.ZERO : minimumRetention;
    }

    /**
     * Decide the tier for a triggered filter. A warning counts while
     * {@code lastWarningAt + window >= now}. A repeat does not move the
     * recorded warning.
     */
    public Tier escalate(String channelId, String userId, Duration window, Instant now) {
        AtomicReference<Tier> tier = new AtomicReference<>();
        states.compute(new Key(channelId, userId), (k, current) -> {
            if (current != null && current.activeAt(now, window)) {
                tier.set(Tier.REPEAT);
                return current.widen(window);
            }
            tier.set(Tier.WARNING);
            return new WarningState(now, window);
        });
        return tier.get();
    }

    public Optional<Instant> lastWarningAt(String channelId, String userId) {
        WarningState state = states.get(new Key(channelId, userId));
        return state == null ? Optional.empty() : Optional.of(state.lastWarningAt());
    }

    /**
     * Forget a user's warning, e.g. when a moderator pardons them.
     */
    public boolean clear(String channelId, String userId) {
        return states.remove(new Key(channelId, userId)) != null;
    }

    /**
     * Drop warnings older than both the longest window they were checked with
     * and the minimum retention.
     *
     * @return number of entries removed
     */
    public int prune(Instant now) {
        int before = states.size();
        states.entrySet().removeIf(e -> {
            WarningState state = e.getValue();
            Duration keep = state.longestWindow().compareTo(minimumRetention) > 0
                    ? state.longestWindow() : minimumRetention;
            return !state.activeAt(now, keep);
        });
        return Math.max(0, before - states.size());
    }

    public int size() {
        return states.size();
    }
}
