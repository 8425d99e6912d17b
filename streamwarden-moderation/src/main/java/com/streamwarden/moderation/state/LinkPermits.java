package com.streamwarden.moderation.state;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Temporary exemptions from the links filter, granted by a moderator.
 */
public class LinkPermits {

    private record Key(String channelId, String userId) {
    }

    private final ConcurrentHashMap<Key, Instant> expiries = new ConcurrentHashMap<>();

    /**
     * @return when the permit expires
     */
    public Instant grant(String channelId, String userId, Duration duration, Instant now) {
        Instant expires = now.plus(duration);
        expiries.put(new Key(channelId, userId), expires);
        return expires;
    }

    public boolean isPermitted(String channelId, String userId, Instant now) {
        Instant expires = expiries.get(new Key(channelId, userId));
        return expires != null && !now.isAfter(expires);
    }

    public boolean revoke(String channelId, String userId) {
        return expiries.remove(new Key(channelId, userId)) != null;
    }

    public int prune(Instant now) {
        int before = expiries.size();
        expiries.values().removeIf(expires -> now.isAfter(expires));
        return Math.max(0, before - expiries.size());
    }
}
