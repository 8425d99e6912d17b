package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Listener bookkeeping and per-channel serialization of {@link #update}.
 */
@Slf4j
public abstract class AbstractModerationPolicyStore implements ModerationPolicyStore {

    protected final ObjectMapper objectMapper;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Object> channelLocks = new ConcurrentHashMap<>();

    protected AbstractModerationPolicyStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void save(ChannelModerationSettings settings) {
        if (settings == null || settings.getChannelId() == null || settings.getChannelId().isBlank()) {
            throw new IllegalArgumentException("settings with a channelId required");
        }
        synchronized (lockFor(settings.getChannelId())) {
            write(copy(settings));
        }
        fireChanged(settings.getChannelId());
    }

    @Override
    public ChannelModerationSettings update(String channelId, UnaryOperator<ChannelModerationSettings> change) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId required");
        }
        ChannelModerationSettings next;
        synchronized (lockFor(channelId)) {
            ChannelModerationSettings current = readForUpdate(channelId)
                    .orElseGet(() -> ModerationDefaults.channel(channelId));
            next = change.apply(current);
            next.setChannelId(channelId);
            write(copy(next));
        }
        fireChanged(channelId);
        return next;
    }

    @Override
    public void addChangeListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    /**
     * Current document for {@link #update}. Empty only when the channel has
     * never been configured; a store that can hold an unreadable document
     * throws instead, so the update does not replace it with defaults.
     */
    protected Optional<ChannelModerationSettings> readForUpdate(String channelId) {
        return find(channelId);
    }

    /**
     * Persist a private copy of the document.
     */
    protected abstract void write(ChannelModerationSettings settings);

    protected ChannelModerationSettings copy(ChannelModerationSettings settings) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(settings), ChannelModerationSettings.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy moderation settings for " + settings.getChannelId(), e);
        }
    }

    private Object lockFor(String channelId) {
        return channelLocks.computeIfAbsent(channelId, k -> new Object());
    }

    private void fireChanged(String channelId) {
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(channelId);
            } catch (RuntimeException e) {
                log.error("Moderation settings listener failed for channel {}: {}", channelId, e.getMessage(), e);
            }
        }
    }
}
