// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import java.util.Locale;

/**
 * Global toggles for verbose debug logging of block assembly.
 *
 * <p>The initial state comes from the {@code smelt.debug} system property:
 * {@code true} (or {@code all}) enables every category, otherwise a comma
 * separated list of {@code block} and {@code receipts} enables those
 * categories only. The toggles can be flipped at runtime.
 *
 * <p>Thread safety: the individual flags are volatile. {@link #isEnabled()}
 * reads them non-atomically, which is fine for best-effort logging.
 */
public final class SmeltDebug {

    /** System property read once when the class is initialized. */
    public static final String PROPERTY = "smelt.debug";

    private static volatile boolean blockLogging;
    private static volatile boolean receiptLogging;

    static {
        configure(System.getProperty(PROPERTY));
    }

    private SmeltDebug() {
    }

    /**
     * Applies a {@code smelt.debug} style setting. {@code null} or blank disables
     * everything.
     *
     * @param setting {@code true}, {@code all}, {@code false} or a comma separated
     *                list of categories
     */
    public static void configure(final String setting) {
        boolean block = false;
        boolean receipts = false;
        if (setting != null) {
            for (final String raw : setting.split(",")) {
                final String category = raw.trim().toLowerCase(Locale.ROOT);
                switch (category) {
                    case "true", "all" -> {
                        block = true;
                        receipts = true;
                    }
                    case "block" -> block = true;
                    case "receipts" -> receipts = true;
                    default -> {
                        // unknown categories and "false" leave the flags untouched
                    }
                }
            }
        }
        blockLogging = block;
        receiptLogging = receipts;
    }

    /**
     * @return true if any debug category is enabled
     */
    public static boolean isEnabled() {
        return blockLogging || receiptLogging;
    }

    public static void setEnabled(final boolean enabled) {
        blockLogging = enabled;
        receiptLogging = enabled;
    }

    public static void setBlockLogging(final boolean enabled) {
        blockLogging = enabled;
    }

    public static boolean isBlockLoggingEnabled() {
        return blockLogging;
    }

    public static void setReceiptLogging(final boolean enabled) {
        receiptLogging = enabled;
    }

    public static boolean isReceiptLoggingEnabled() {
        return receiptLogging;
    }
}
