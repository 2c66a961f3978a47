package com.aboutblank.controller;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing for optional numeric query parameters.
 *
 * Mobile clients send {@code limit} in whatever shape they have at hand, so a
 * value is read from its leading integer ("25", " 25", "25items") and anything
 * without one ("abc", "") is treated as absent. The services then apply their
 * default and maximum.
 */
final class QueryParams {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private QueryParams() {
    }

    /**
     * Parse a limit parameter.
     *
     * @param raw the raw query value, may be null
     * @return the leading integer, saturated to the int range, or null when there is none
     */
    static Integer parseLimit(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = LEADING_INTEGER.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1);
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException ex) {
            // Only overflow gets here; the pattern guarantees digits.
            return digits.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }
}
