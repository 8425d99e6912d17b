package com.streamwarden.moderation.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds links in chat text: scheme URLs, bare domains and IPv4 hosts, and
 * non-web URI schemes. The aggressive mode also catches spelled-out dots
 * ("example dot com", "example[.]com").
 */
public final class LinkDetector {

    public record Link(String text, String host) {
    }

    private static final String TLD = "(?:aero|a[cdefgilmnoqrstuwxz]|biz|bike|bot|b[abdefghijmnorstvwyz]"
            + "|com|c[acdfghiklmnoruvxyz]|d[ejkmoz]|edu|e[cegrstu]|fyi|f[ijkmor]|gov|g[abdefghilmnpqrstuwy]"
            + "|how|h[kmnrtu]|info|i[delmnoqrst]|jobs|j[emop]|k[eghimnrwyz]|l[abcikrstuvy]"
            + "|mil|mobi|moe|m[acdeghklmnopqrstuvwxyz]|name|net|n[acefgilopruz]|org|om|pro|p[aefghklmnrstwy]"
            + "|qa|r[eouw]|s[abcdeghijklmnortuvyz]|t[cdfghjklmnoprtvwz]|u[agkmsyz]|vote|v[ceginu]|xxx"
            + "|watch|w[fs]|y[etu]|z[amw])";

    private static final String NON_WEB_SCHEMES = "(?:magnet|mailto|ed2k|irc|ircs|skype|ymsgr|xfire|steam|aim|spotify)";

    private static final String OCTET = "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

    private static final Pattern LINK = Pattern.compile(
            "(?:https?|rtsp|ftp)://[^\\s]+"
                    + "|(?<![\\w.+-])" + NON_WEB_SCHEMES + ":(?://)?[^\\s]+"
                    + "|(?<![\\w.@-])(?:[a-z0-9][a-z0-9-]{0,62}\\.)+" + TLD + "(?![a-z0-9-])(?::\\d{1,5})?(?:/[^\\s]*)?"
                    + "|(?<![\\w.])" + OCTET + "(?:\\." + OCTET + "){3}(?![\\w.])(?::\\d{1,5})?(?:/[^\\s]*)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern OBFUSCATED = Pattern.compile(
            "(?<![\\w-])([a-z0-9][a-z0-9-]{0,62})\\s*"
                    + "(?:\\(\\s*(?:dot|\\.)\\s*\\)|\\[\\s*(?:dot|\\.)\\s*]|\\{\\s*(?:dot|\\.)\\s*}|\\s+dot\\s+|\\s+\\.\\s*|\\.\\s+)"
                    + "\\s*(" + TLD + ")(?![a-z0-9-])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HIERARCHICAL_SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern OPAQUE_SCHEME = Pattern.compile("^" + NON_WEB_SCHEMES + ":(?!//)");

    private LinkDetector() {
    }

    public static List<Link> find(String text, boolean aggressive) {
        List<Link> links = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return links;
        }
        Matcher m = LINK.matcher(text);
        while (m.find()) {
            String link = m.group().toLowerCase(Locale.ROOT);
            links.add(new Link(link, hostOf(link)));
        }
        if (aggressive) {
            Matcher o = OBFUSCATED.matcher(text);
            while (o.find()) {
                String host = (o.group(1) + "." + o.group(2)).toLowerCase(Locale.ROOT);
                links.add(new Link(host, host));
            }
        }
        return links;
    }

    /**
     * Host part of a lower-cased link, or null for URIs without one
     * ({@code mailto:}, {@code magnet:}).
     */
    static String hostOf(String link) {
        if (OPAQUE_SCHEME.matcher(link).find()) {
            return null;
        }
        String rest = link;
        Matcher scheme = HIERARCHICAL_SCHEME.matcher(rest);
        if (scheme.find()) {
            rest = rest.substring(scheme.end());
        }
        int at = rest.indexOf('@');
        int slash = rest.indexOf('/');
        if (at >= 0 && (slash < 0 || at < slash)) {
            rest = rest.substring(at + 1);
        }
        int end = rest.length();
        for (char stop : new char[] { '/', ':', '?', '#' }) {
            int i = rest.indexOf(stop);
            if (i >= 0 && i < end) {
                end = i;
            }
        }
        String host = rest.substring(0, end);
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.isEmpty() ? null : host;
    }
}
