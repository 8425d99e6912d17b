package com.streamwarden.permission.actor;

import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.GlobalStanding;
import com.streamwarden.common.level.UserLevels;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryActorDirectory implements ActorDirectory {

    private record Key(String channelId, String userId) {
    }

    // Channel records always carry GlobalStanding.NONE; the real value is merged on read.
    private final ConcurrentHashMap<Key, Actor> actors = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, GlobalStanding> standings = new ConcurrentHashMap<>();

    @Override
    public Optional<Actor> find(String channelId, String userId) {
        if (channelId == null || userId == null) {
            return Optional.empty();
        }
        GlobalStanding standing = globalStanding(userId);
        Actor actor = actors.get(new Key(channelId, userId));
        if (actor == null) {
            return standing == GlobalStanding.NONE
                    ? Optional.empty()
                    : Optional.of(Actor.viewer(userId).withStanding(standing));
        }
        return Optional.of(actor.withStanding(standing));
    }

    @Override
    public Actor observe(String channelId, String userId, UserLevels levelInChannel) {
        requireIds(channelId, userId);
        Actor stored = actors.compute(new Key(channelId, userId), (k, current) -> current == null
                ? Actor.viewer(userId).withLevel(levelInChannel)
                : current.withLevel(levelInChannel));
        return stored.withStanding(globalStanding(userId));
    }

    @Override
    public void setGlobalStanding(String userId, GlobalStanding standing) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId required");
        }
        if (standing == null || standing == GlobalStanding.NONE) {
            standings.remove(userId);
        } else {
            standings.put(userId, standing);
        }
    }

    @Override
    public GlobalStanding globalStanding(String userId) {
        return standings.getOrDefault(userId, GlobalStanding.NONE);
    }

    @Override
    public Actor addMembership(String channelId, String userId, String groupId) {
        requireIds(channelId, userId);
        Actor stored = actors.compute(new Key(channelId, userId), (k, current) -> (current == null
                ? Actor.viewer(userId)
                : current).withMembership(groupId));
        return stored.withStanding(globalStanding(userId));
    }

    @Override
    public boolean removeMembership(String channelId, String userId, String groupId) {
        requireIds(channelId, userId);
        AtomicBoolean removed = new AtomicBoolean(false);
        actors.computeIfPresent(new Key(channelId, userId), (k, current) -> {
            Actor next = current.withoutMembership(groupId);
            removed.set(next != current);
            return next;
        });
        return removed.get();
    }

    @Override
    public int removeGroupFromAll(String channelId, String groupId) {
        AtomicInteger changed = new AtomicInteger();
        for (Key key : actors.keySet()) {
            if (!key.channelId().equals(channelId)) {
                continue;
            }
            actors.computeIfPresent(key, (k, current) -> {
                Actor next = current.withoutMembership(groupId);
                if (next != current) {
                    changed.incrementAndGet();
                }
                return next;
            });
        }
        return changed.get();
    }

    private static void requireIds(String channelId, String userId) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId required");
        }
    }
}
