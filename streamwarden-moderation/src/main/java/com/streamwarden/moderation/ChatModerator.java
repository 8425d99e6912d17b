package com.streamwarden.moderation;

import com.streamwarden.common.level.Actor;
import com.streamwarden.common.logging.SubsystemLogger;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.NoticeThrottle;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-message moderation pipeline: cache the message, run every filter, keep
 * the harshest decision, throttle its chat notice and log it.
 */
public class ChatModerator {

    private static final SubsystemLogger log = SubsystemLogger.create("moderation");

    private final ModerationEngine engine;
    private final CompiledPolicyCache policies;
    private final MessageCache messageCache;
    private final NoticeThrottle noticeThrottle;
    private final ModerationLog moderationLog;
    private final Clock clock;

    public ChatModerator(ModerationEngine engine, CompiledPolicyCache policies, MessageCache messageCache,
            NoticeThrottle noticeThrottle, ModerationLog moderationLog, Clock clock) {
        this.engine = engine;
        this.policies = policies;
        this.messageCache = messageCache;
        this.noticeThrottle = noticeThrottle;
        this.moderationLog = moderationLog;
        this.clock = clock;
    }

    /**
     * @return the punishment to apply, empty when the message is fine
     */
    public Optional<ModerationOutcome> moderate(ChatMessage message, Actor actor) {
        Instant now = clock.instant();
        messageCache.record(message, now);

        List<ModerationDecision> decisions = engine.evaluateAll(message, actor);
        ModerationDecision harshest = null;
        for (ModerationDecision decision : decisions) {
            if (!decision.punishment().isNone() && decision.isHarsherThan(harshest)) {
                harshest = decision;
            }
        }
        if (harshest == null) {
            return Optional.empty();
        }

        boolean sendNotice = harshest.punishment().userFacingMessage() != null
                && noticeThrottle.tryAcquire(message.channelId(),
                        policies.channel(message.channelId()).noticeCooldown(), now);

        moderationLog.append(new ModerationLog.Entry(now, message.channelId(), message.userId(),
                message.userLogin(), harshest.kind(), harshest.tier(), harshest.punishment(), harshest.rule()));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("user", message.userLogin() != null ? message.userLogin() : message.userId());
        meta.put("filter", harshest.rule());
        meta.put("tier", harshest.tier());
        meta.put("punishment", harshest.punishment().kind());
        if (harshest.punishment().durationSeconds() > 0) {
            meta.put("seconds", harshest.punishment().durationSeconds());
        }
        log.forChannel(message.channelId()).info("Punishing message", meta);

        return Optional.of(new ModerationOutcome(harshest, sendNotice));
    }
}
