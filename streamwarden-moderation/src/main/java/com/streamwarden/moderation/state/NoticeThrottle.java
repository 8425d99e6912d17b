package com.streamwarden.moderation.state;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-channel cooldown for moderation notices in chat. Punishments are never
 * throttled, only the message announcing them.
 */
public class NoticeThrottle {

    private final ConcurrentHashMap<String, Instant> lastNotice = new ConcurrentHashMap<>();

    /**
     * Claim the channel's notice slot if the cooldown has passed.
     */
    public boolean tryAcquire(String channelId, Duration cooldown, Instant now) {
        if (cooldown.isZero() || cooldown.isNegative()) {
            lastNotice.put(channelId, now);
            return true;
        }
        AtomicBoolean acquired = new AtomicBoolean(false);
        lastNotice.compute(channelId, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                acquired.set(true);
                return now;
            }
            return last;
        });
        return acquired.get();
    }
}
