package com.streamwarden.moderation.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Allowed link targets. An entry containing "://" or ending in ':' is a URI
 * prefix; anything else is a domain that also covers its subdomains.
 */
public final class LinkAllowlist {

    private static final LinkAllowlist EMPTY = new LinkAllowlist(List.of(), List.of(), false);

    private final List<String> domains;
    private final List<String> prefixes;
    private final boolean allowClips;

    private LinkAllowlist(List<String> domains, List<String> prefixes, boolean allowClips) {
        this.domains = domains;
        this.prefixes = prefixes;
        this.allowClips = allowClips;
    }

    public static LinkAllowlist empty() {
        return EMPTY;
    }

    public static LinkAllowlist of(List<String> entries, boolean allowClips) {
        List<String> domains = new ArrayList<>();
        List<String> prefixes = new ArrayList<>();
        for (String raw : entries) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String entry = raw.trim().toLowerCase(Locale.ROOT);
            if (entry.contains("://") || entry.endsWith(":")) {
                prefixes.add(entry);
            } else {
                domains.add(trimDomain(entry));
            }
        }
        return new LinkAllowlist(List.copyOf(domains), List.copyOf(prefixes), allowClips);
    }

    /**
     * @param link the matched link text, lower-cased
     * @param host its host, or null when the link has none
     */
    public boolean allows(String link, String host) {
        for (String prefix : prefixes) {
            if (link.startsWith(prefix)) {
                return true;
            }
        }
        if (host == null) {
            return false;
        }
        if (allowClips && isClip(link, host)) {
            return true;
        }
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return domains.isEmpty() && prefixes.isEmpty() && !allowClips;
    }

    private static boolean isClip(String link, String host) {
        if (host.equals("clips.twitch.tv")) {
            return true;
        }
        return (host.equals("twitch.tv") || host.endsWith(".twitch.tv")) && link.contains("/clip/");
    }

    private static String trimDomain(String entry) {
        String domain = entry;
        if (domain.startsWith("*.")) {
            domain = domain.substring(2);
        }
        if (domain.startsWith(".")) {
            domain = domain.substring(1);
        }
        int slash = domain.indexOf('/');
        return slash >= 0 ? domain.substring(0, slash) : domain;
    }
}
