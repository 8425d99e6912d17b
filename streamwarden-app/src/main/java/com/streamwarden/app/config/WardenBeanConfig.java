package com.streamwarden.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamwarden.app.chat.ChatReplySink;
import com.streamwarden.app.chat.LoggingActionExecutor;
import com.streamwarden.app.chat.LoggingReplySink;
import com.streamwarden.app.chat.ModerationActionExecutor;
import com.streamwarden.common.config.ConfigService;
import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.level.GlobalStanding;
import com.streamwarden.moderation.ChatModerator;
import com.streamwarden.moderation.ModerationEngine;
import com.streamwarden.moderation.ModerationLog;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.policy.JsonModerationPolicyStore;
import com.streamwarden.moderation.policy.ModerationPolicyStore;
import com.streamwarden.moderation.state.LinkPermits;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.NoticeThrottle;
import com.streamwarden.moderation.state.WarningStateTracker;
import com.streamwarden.permission.PermissionResolver;
import com.streamwarden.permission.PermissionService;
import com.streamwarden.permission.actor.ActorDirectory;
import com.streamwarden.permission.actor.InMemoryActorDirectory;
import com.streamwarden.permission.registry.ConcurrentPermissionRegistry;
import com.streamwarden.permission.registry.PermissionRegistry;
import com.streamwarden.permission.store.InMemoryPermissionStore;
import com.streamwarden.permission.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the permission and moderation beans.
 */
@Slf4j
@Configuration
public class WardenBeanConfig {

    @Value("${streamwarden.config.path:~/.streamwarden/config.json}")
    private String configPath;

    @Value("${streamwarden.policy.cache-max-age:PT5M}")
    private Duration policyCacheMaxAge;

    @Value("${streamwarden.message-cache.per-channel:2000}")
    private int messagesPerChannel;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(Path.of(configPath)));
    }

    @Bean
    public WardenConfig wardenConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // =========================================================================
    // Permissions
    // =========================================================================

    @Bean
    public PermissionStore permissionStore() {
        return new InMemoryPermissionStore();
    }

    @Bean
    public ActorDirectory actorDirectory(WardenConfig config) {
        ActorDirectory actors = new InMemoryActorDirectory();
        if (config.getBot().getSuperAdmins() != null) {
            for (String userId : config.getBot().getSuperAdmins()) {
                if (userId != null && !userId.isBlank()) {
                    actors.setGlobalStanding(userId.trim(), GlobalStanding.SUPER_ADMIN);
                }
            }
        }
        return actors;
    }

    @Bean
    public PermissionRegistry permissionRegistry() {
        return new ConcurrentPermissionRegistry();
    }

    @Bean
    public PermissionResolver permissionResolver(PermissionStore store, ActorDirectory actors) {
        return new PermissionResolver(store, actors);
    }

    @Bean
    public PermissionService permissionService(PermissionStore store, ActorDirectory actors,
            PermissionRegistry registry) {
        return new PermissionService(store, actors, registry);
    }

    // =========================================================================
    // Moderation
    // =========================================================================

    @Bean
    public ModerationPolicyStore moderationPolicyStore(WardenConfig config, ObjectMapper objectMapper) {
        Path dir = ConfigService.expandHome(Path.of(config.getModeration().getPolicyDir()));
        log.info("Moderation settings directory: {}", dir);
        return new JsonModerationPolicyStore(dir, objectMapper);
    }

    @Bean
    public CompiledPolicyCache compiledPolicyCache(ModerationPolicyStore store, WardenConfig config) {
        return new CompiledPolicyCache(store,
                Duration.ofSeconds(config.getModeration().getDefaultWarningWindowSeconds()),
                policyCacheMaxAge);
    }

    @Bean
    public WarningStateTracker warningStateTracker(WardenConfig config) {
        return new WarningStateTracker(Duration.ofSeconds(config.getModeration().getDefaultWarningWindowSeconds()));
    }

    @Bean
    public MessageCache messageCache() {
        return new MessageCache(messagesPerChannel);
    }

    @Bean
    public LinkPermits linkPermits() {
        return new LinkPermits();
    }

    @Bean
    public ModerationLog moderationLog(WardenConfig config) {
        return new ModerationLog(config.getModeration().getModerationLogSize());
    }

    @Bean
    public ModerationEngine moderationEngine(CompiledPolicyCache policies, PermissionResolver resolver,
            WarningStateTracker warnings, MessageCache messageCache, LinkPermits permits, Clock clock) {
        return new ModerationEngine(policies, resolver, warnings, messageCache, permits, clock);
    }

    @Bean
    public ChatModerator chatModerator(ModerationEngine engine, CompiledPolicyCache policies,
            MessageCache messageCache, ModerationLog moderationLog, Clock clock) {
        return new ChatModerator(engine, policies, messageCache, new NoticeThrottle(), moderationLog, clock);
    }

    // =========================================================================
    // Chat transport boundary
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public ModerationActionExecutor moderationActionExecutor() {
        return new LoggingActionExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatReplySink chatReplySink() {
        return new LoggingReplySink();
    }
}
