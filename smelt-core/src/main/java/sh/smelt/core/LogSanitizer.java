// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import java.util.regex.Pattern;

/**
 * Keeps debug log payloads readable.
 *
 * <p>Block payloads can carry arbitrarily large hex blobs (calldata, extra data,
 * whole encoded blocks). Hex runs longer than {@value #MAX_HEX_DIGITS} digits are
 * elided in the middle and the whole message is capped at
 * {@value #MAX_LOG_LENGTH} characters.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final int MAX_HEX_DIGITS = 128;

    private static final int HEX_KEEP = 16;

    private static final Pattern LONG_HEX = Pattern.compile("0x[0-9a-fA-F]{" + (MAX_HEX_DIGITS + 1) + ",}");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("0x")) {
            sanitized = LONG_HEX.matcher(sanitized).replaceAll(match -> {
                final String hex = match.group();
                final int hidden = hex.length() - 2 - 2 * HEX_KEEP;
                return hex.substring(0, 2 + HEX_KEEP)
                        + "...(" + hidden / 2 + " bytes)..."
                        + hex.substring(hex.length() - HEX_KEEP);
            });
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
