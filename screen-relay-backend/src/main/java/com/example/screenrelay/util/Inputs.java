package com.example.screenrelay.util;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalisation of user-supplied text after it passed bean validation.
 */
public final class Inputs {
    public static final int MAX_NAME_LENGTH = 50;

    private Inputs() {
    }

    public static String displayName(String raw) {
        String cleaned = stripControl(raw).trim();
        return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(0, MAX_NAME_LENGTH) : cleaned;
    }

    public static String roomCode(String raw) {
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Empty when the message is missing, blank, or longer than {@code maxLength}. */
    public static Optional<String> chatMessage(String raw, int maxLength) {
        if (isBlank(raw) || raw.length() > maxLength) {
            return Optional.empty();
        }
        return Optional.of(raw);
    }

    private static String stripControl(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        raw.codePoints()
                .filter(cp -> !Character.isISOControl(cp))
                .forEach(out::appendCodePoint);
        return out.toString();
    }
}
