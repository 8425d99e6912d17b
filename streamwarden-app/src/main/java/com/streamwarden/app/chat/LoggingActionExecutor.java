package com.streamwarden.app.chat;

import com.streamwarden.moderation.ModerationDecision;
import com.streamwarden.moderation.policy.PunishmentSpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Default executor used when no chat transport is wired in: logs the chat
 * command that would carry out each decision.
 */
@Slf4j
public class LoggingActionExecutor implements ModerationActionExecutor {

    @Override
    public void apply(String channelId, String userLogin, ModerationDecision decision, boolean sendNotice) {
        String command = chatCommandFor(userLogin, decision.punishment());
        log.info("[#{}] {} ({} {})", channelId, command, decision.rule(), decision.tier());
        if (sendNotice) {
            log.info("[#{}] @{}, {}", channelId, userLogin, decision.punishment().userFacingMessage());
        }
    }

    /**
     * The moderator chat command that applies a punishment; null for none.
     */
    public static String chatCommandFor(String userLogin, PunishmentSpec punishment) {
        String reason = punishment.reasonText() != null && !punishment.reasonText().isBlank()
                ? " " + punishment.reasonText()
                : "";
        return switch (punishment.kind()) {
            case NONE -> null;
            case DELETE -> "/delete (message of " + userLogin + ")";
            case PURGE -> "/timeout " + userLogin + " 1" + reason;
            case TIMEOUT -> "/timeout " + userLogin + " " + punishment.durationSeconds() + reason;
            case BAN -> "/ban " + userLogin + reason;
        };
    }
}
