package com.streamwarden.moderation.policy;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Storage boundary for channel moderation documents. Returned documents are
 * copies; change them through {@link #save} or {@link #update}.
 */
public interface ModerationPolicyStore {

    /**
     * Empty when the channel has no document, or its document cannot be read.
     */
    Optional<ChannelModerationSettings> find(String channelId);

    void save(ChannelModerationSettings settings);

    /**
     * Atomically apply a change to a channel document, starting from
     * {@link ModerationDefaults#channel} when none exists.
     */
    ChannelModerationSettings update(String channelId, UnaryOperator<ChannelModerationSettings> change);

    /**
     * Called with the channel id after every save.
     */
    void addChangeListener(Consumer<String> listener);
}
