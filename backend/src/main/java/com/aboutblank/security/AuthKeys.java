package com.aboutblank.security;

import java.util.regex.Pattern;

/**
 * Helpers for the opaque auth key clients send in the auth header.
 *
 * A key is the hex encoding of a 256-bit digest computed on the device. The
 * server never sees the input it was derived from and treats the key itself
 * as the user's identity.
 */
public final class AuthKeys {

    /**
     * Exactly 64 hexadecimal characters, either case.
     */
    private static final Pattern AUTH_KEY_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    private static final int LOG_PREFIX_LENGTH = 8;

    private AuthKeys() {
    }

    /**
     * Check that a header value has the shape of an auth key.
     *
     * @param authKey raw header value, may be null
     * @return true if the value is 64 hex characters
     */
    public static boolean isValid(String authKey) {
        return authKey != null && AUTH_KEY_PATTERN.matcher(authKey).matches();
    }

    /**
     * Shorten a key for log output. Full keys are credentials and never logged.
     *
     * @param authKey raw key, may be null
     * @return the first 8 characters followed by "...", or a placeholder
     */
    public static String abbreviate(String authKey) {
        if (authKey == null || authKey.isEmpty()) {
            return "<none>";
        }
        if (authKey.length() <= LOG_PREFIX_LENGTH) {
            return authKey + "...";
        }
        return authKey.substring(0, LOG_PREFIX_LENGTH) + "...";
    }
}
