// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for block assembly.
 *
 * <p>Every message is sanitized before output. On a TTY messages go straight to
 * stdout so the colors from {@link LogFormatter} render; everywhere else they
 * go through SLF4J under the {@value #LOGGER_NAME} logger.
 */
public final class DebugLogger {

    public static final String LOGGER_NAME = "sh.smelt.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    public static void logBlock(final String message, final Object... args) {
        if (!SmeltDebug.isBlockLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logReceipts(final String message, final Object... args) {
        if (!SmeltDebug.isReceiptLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!SmeltDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
