package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryModerationPolicyStore extends AbstractModerationPolicyStore {

    private final ConcurrentHashMap<String, ChannelModerationSettings> documents = new ConcurrentHashMap<>();

    public InMemoryModerationPolicyStore() {
        this(new ObjectMapper());
    }

    public InMemoryModerationPolicyStore(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Optional<ChannelModerationSettings> find(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        ChannelModerationSettings stored = documents.get(channelId);
        return stored == null ? Optional.empty() : Optional.of(copy(stored));
    }

    @Override
    protected void write(ChannelModerationSettings settings) {
        documents.put(settings.getChannelId(), settings);
    }
}
