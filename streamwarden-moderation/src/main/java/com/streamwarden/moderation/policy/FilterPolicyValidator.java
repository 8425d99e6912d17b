package com.streamwarden.moderation.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks that a policy carries everything its kind needs. A policy with
 * problems is not applied.
 */
public final class FilterPolicyValidator {

    private FilterPolicyValidator() {
    }

    /**
     * @return human-readable problems, empty when the policy is usable
     */
    public static List<String> validate(FilterKind kind, FilterPolicy policy) {
        List<String> problems = new ArrayList<>();
        if (policy == null) {
            problems.add("policy missing");
            return problems;
        }
        if (kind.isTiered()) {
            checkTier("warningTier", policy.getWarningTier(), problems);
            checkTier("repeatTier", policy.getRepeatTier(), problems);
        }
        nonNegative("warningWindowSeconds", policy.getWarningWindowSeconds(), false, problems);

        switch (kind) {
            case CAPS -> {
                nonNegative("minimumMessageLength", policy.getMinimumMessageLength(), true, problems);
                percentage(policy.getMaximumPercentage(), problems);
            }
            case SYMBOLS -> {
                nonNegative("minimumMessageLength", policy.getMinimumMessageLength(), true, problems);
                percentage(policy.getMaximumPercentage(), problems);
                positive("maximumGrouped", policy.getMaximumGrouped(), problems);
            }
            case LENGTHY_MESSAGE -> positive("maximumLength", policy.getMaximumLength(), problems);
            case REPETITION -> {
                nonNegative("minimumMessageLength", policy.getMinimumMessageLength(), true, problems);
                positive("maximumRepeatingCharacters", policy.getMaximumRepeatingCharacters(), problems);
                positive("maximumRepeatingWords", policy.getMaximumRepeatingWords(), problems);
            }
            case EMOTES -> positive("maximumAllowed", policy.getMaximumAllowed(), problems);
            case ONE_MAN_SPAM -> {
                positive("maximumMessages", policy.getMaximumMessages(), problems);
                positive("resetWindowSeconds", policy.getResetWindowSeconds(), problems);
            }
            case LINKS -> {
                nonNegative("permitSeconds", policy.getPermitSeconds(), false, problems);
                for (String allowed : policy.allowlistOrEmpty()) {
                    if (allowed == null || allowed.isBlank()) {
                        problems.add("allowlist contains a blank entry");
                    }
                }
            }
            case BLACKLIST -> checkBlacklist(policy.getBlacklist(), problems);
            default -> {
            }
        }
        return problems;
    }

    private static void checkTier(String field, PunishmentSpec tier, List<String> problems) {
        if (tier == null) {
            problems.add(field + " missing");
        } else if (tier.kind() == PunishmentKind.TIMEOUT && tier.durationSeconds() <= 0) {
            problems.add(field + " timeout needs a positive duration");
        }
    }

    private static void checkBlacklist(List<BlacklistEntry> entries, List<String> problems) {
        if (entries == null) {
            problems.add("blacklist missing");
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            BlacklistEntry entry = entries.get(i);
            if (entry == null || entry.phrase() == null || entry.phrase().isBlank()) {
                problems.add("blacklist[" + i + "] has no phrase");
                continue;
            }
            checkTier("blacklist[" + i + "].punishment", entry.punishment(), problems);
            if (entry.regex()) {
                try {
                    Pattern.compile(entry.phrase());
                } catch (PatternSyntaxException e) {
                    problems.add("blacklist[" + i + "] invalid pattern: " + e.getDescription());
                }
            }
        }
    }

    private static void percentage(Integer value, List<String> problems) {
        if (value == null) {
            problems.add("maximumPercentage missing");
        } else if (value < 0 || value > 100) {
            problems.add("maximumPercentage must be between 0 and 100");
        }
    }

    private static void positive(String field, Integer value, List<String> problems) {
        if (value == null) {
            problems.add(field + " missing");
        } else if (value <= 0) {
            problems.add(field + " must be positive");
        }
    }

    private static void nonNegative(String field, Integer value, boolean required, List<String> problems) {
        if (value == null) {
            if (required) {
                problems.add(field + " missing");
            }
        } else if (value < 0) {
            problems.add(field + " must not be negative");
        }
    }
}
