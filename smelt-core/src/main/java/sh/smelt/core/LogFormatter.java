// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import static sh.smelt.core.AnsiColors.*;

import java.util.Locale;

/**
 * Formats debug lines for block assembly.
 *
 * <p>
 * Every line has a bracketed operation tag, long hashes are shortened to
 * {@code 0x1234...5678}, and durations are rendered as {@code 1.5ms}:
 *
 * <pre>
 * ✓ [BLOCK-ASSEMBLED] number=12 hash=0x1a2b...9f0e txs=2 ommers=0 withdrawals=none duration=210μs
 * [RECEIPTS] block=0x1a2b...9f0e receipts=2 logs=3
 * </pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened hash, including "0x". */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened hash. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [BLOCK-ASSEMBLED] number=12 hash=0x1a2b...9f0e txs=2 ommers=0
     * withdrawals=none duration=210μs
     *
     * @param withdrawals number of withdrawals, or a negative value when the block
     *                    carries none
     */
    public static String formatBlockAssembled(
            long number, String hash, int transactions, int ommers, int withdrawals, long durationMicros) {
        return String.format(
                "%s✓%s %s[BLOCK-ASSEMBLED]%s number=%d hash=%s txs=%d ommers=%d withdrawals=%s %s",
                TEAL, RESET,
                INDIGO, RESET,
                number,
                shortenHash(hash),
                transactions,
                ommers,
                withdrawals < 0 ? "none" : String.valueOf(withdrawals),
                duration(durationMicros));
    }

    /**
     * Format: [RECEIPTS] block=0x1a2b...9f0e receipts=2 logs=3
     */
    public static String formatReceipts(String blockHash, int receipts, long logs) {
        return String.format(
                "%s[RECEIPTS]%s block=%s receipts=%d logs=%d",
                LAVENDER, RESET,
                shortenHash(blockHash),
                receipts,
                logs);
    }

    /**
     * Shortens a hex value to {@code 0x1234...5678}. Short or null values are
     * returned unchanged.
     */
    public static String shortenHash(String hash) {
        if (hash == null || hash.length() <= HASH_SHORTEN_THRESHOLD) {
            return hash;
        }
        return hash.substring(0, HASH_PREFIX_LENGTH) + "..." + hash.substring(hash.length() - HASH_SUFFIX_LENGTH);
    }

    /**
     * Format: duration=1.5ms, or duration=850μs below one millisecond.
     */
    static String duration(long durationMicros) {
        final String value;
        if (durationMicros < 1_000) {
            value = durationMicros + "μs";
        } else if (durationMicros < 1_000_000) {
            value = String.format(Locale.ROOT, "%.1fms", durationMicros / 1_000.0);
        } else {
            value = String.format(Locale.ROOT, "%.1fs", durationMicros / 1_000_000.0);
        }
        return SLATE + "duration=" + value + RESET;
    }
}
