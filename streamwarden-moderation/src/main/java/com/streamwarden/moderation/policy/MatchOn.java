package com.streamwarden.moderation.policy;

/**
 * What a blacklist entry is tested against.
 */
public enum MatchOn {
    MESSAGE,
    USERNAME,
    MESSAGE_AND_USERNAME
}
