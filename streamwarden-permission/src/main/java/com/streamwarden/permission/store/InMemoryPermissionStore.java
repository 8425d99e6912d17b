package com.streamwarden.permission.store;

import com.streamwarden.permission.PermissionGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link PermissionStore}. Each group is a single map entry, so
 * {@link ConcurrentHashMap#compute} gives per-group atomicity.
 */
@Slf4j
public class InMemoryPermissionStore implements PermissionStore {

    private record NameKey(String channelId, String name) {
    }

    private final ConcurrentHashMap<String, PermissionGroup> groups = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<NameKey, String> nameIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<PermissionGroup> findById(String groupId) {
        if (groupId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public Optional<PermissionGroup> findByName(String channelId, String name) {
        if (channelId == null || name == null || name.isBlank()) {
            return Optional.empty();
        }
        String id = nameIndex.get(new NameKey(channelId, PermissionGroup.nameKey(name)));
        return findById(id);
    }

    @Override
    public List<PermissionGroup> findByChannel(String channelId) {
        return groups.values().stream()
                .filter(g -> g.channelId().equals(channelId))
                .sorted(Comparator.comparing(g -> PermissionGroup.nameKey(g.name())))
                .toList();
    }

    @Override
    public CreateResult create(String channelId, String name) {
        NameKey key = new NameKey(channelId, PermissionGroup.nameKey(name));
        AtomicBoolean created = new AtomicBoolean(false);
        String id = nameIndex.computeIfAbsent(key, k -> {
            PermissionGroup group = new PermissionGroup(UUID.randomUUID().toString(), channelId, name, List.of());
            groups.put(group.id(), group);
            created.set(true);
            return group.id();
        });
        PermissionGroup group = groups.get(id);
        if (group == null) {
            // lost a race with delete(); the index entry is gone by now
            return create(channelId, name);
        }
        return new CreateResult(group, created.get());
    }

    @Override
    public Optional<PermissionGroup> update(String groupId, UnaryOperator<PermissionGroup> change) {
        PermissionGroup updated = groups.computeIfPresent(groupId, (id, current) -> {
            PermissionGroup next = change.apply(current);
            if (!next.id().equals(current.id()) || !next.channelId().equals(current.channelId())) {
                throw new IllegalStateException("update must not change group identity: " + groupId);
            }
            return next;
        });
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean delete(String groupId) {
        PermissionGroup removed = groups.remove(groupId);
        if (removed == null) {
            return false;
        }
        nameIndex.remove(new NameKey(removed.channelId(), PermissionGroup.nameKey(removed.name())), groupId);
        return true;
    }

    @Override
    public int removePermissionFromAllGroups(String normalizedName) {
        AtomicInteger changed = new AtomicInteger();
        for (String id : groups.keySet()) {
            groups.computeIfPresent(id, (k, current) -> {
                PermissionGroup next = current.withoutEntry(normalizedName);
                if (next != current) {
                    changed.incrementAndGet();
                }
                return next;
            });
        }
        log.debug("Removed permission {} from {} group(s)", normalizedName, changed.get());
        return changed.get();
    }
}
