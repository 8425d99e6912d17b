package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

import java.util.regex.Pattern;

/**
 * Flags characters outside Latin, Cyrillic, general punctuation, currency
 * signs and the supplementary planes (emoji). Stacked combining marks fall
 * outside, except U+0308.
 */
public class ZalgoFilter implements MessageFilter {

    static final Pattern OUTSIDE_ALLOWED = Pattern.compile(
            "[^\\x{0009}-\\x{02B7}\\x{0308}\\x{0401}\\x{0410}-\\x{044F}\\x{0451}"
                    + "\\x{2000}-\\x{20BF}\\x{2122}\\x{10000}-\\x{10FFFF}]");

    @Override
    public FilterKind kind() {
        return FilterKind.ZALGO;
    }

    @Override
    public boolean triggers(FilterContext context) {
        return OUTSIDE_ALLOWED.matcher(context.text().stripped()).find();
    }
}
