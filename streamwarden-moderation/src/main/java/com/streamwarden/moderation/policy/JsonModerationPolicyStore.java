package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One {@code <channelId>.json} document per channel in a directory. An
 * unreadable document is logged and treated as absent by {@link #find};
 * {@link #update} refuses to touch it until an operator repairs the file.
 */
@Slf4j
public class JsonModerationPolicyStore extends AbstractModerationPolicyStore {

    private static final Pattern SAFE_CHANNEL_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path directory;

    public JsonModerationPolicyStore(Path directory, ObjectMapper objectMapper) {
        super(objectMapper);
        this.directory = directory;
    }

    @Override
    public Optional<ChannelModerationSettings> find(String channelId) {
        try {
            return read(channelId);
        } catch (UncheckedIOException e) {
            log.error("Failed to read moderation settings for channel {}: {}", channelId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    protected Optional<ChannelModerationSettings> readForUpdate(String channelId) {
        return read(channelId);
    }

    /**
     * @throws UncheckedIOException when the channel's document exists but
     *                              cannot be parsed
     */
    private Optional<ChannelModerationSettings> read(String channelId) {
        if (channelId == null || !SAFE_CHANNEL_ID.matcher(channelId).matches()) {
            return Optional.empty();
        }
        Path file = fileFor(channelId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            ChannelModerationSettings settings = objectMapper.readValue(file.toFile(), ChannelModerationSettings.class);
            if (settings.getChannelId() == null) {
                settings.setChannelId(channelId);
            }
            return Optional.of(settings);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable moderation settings " + file, e);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException("Unreadable moderation settings " + file, new IOException(e));
        }
    }

    @Override
    protected void write(ChannelModerationSettings settings) {
        String channelId = settings.getChannelId();
        if (!SAFE_CHANNEL_ID.matcher(channelId).matches()) {
            throw new IllegalArgumentException("channelId not usable as a file name: " + channelId);
        }
        Path file = fileFor(channelId);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, channelId, ".tmp");
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(tmp.toFile(), settings);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Moderation settings saved to: {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save moderation settings to " + file, e);
        }
    }

    private Path fileFor(String channelId) {
        return directory.resolve(channelId + ".json");
    }
}
