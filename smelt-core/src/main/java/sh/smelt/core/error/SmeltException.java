// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.error;

/**
 * Base runtime exception for all smelt failures.
 *
 * <p>
 * Sealed so that callers can catch every library failure with one clause while
 * the set of concrete failures stays closed.
 *
 * <pre>
 * SmeltException
 * └── {@link BlockAssemblyException} - inconsistent inputs to block assembly
 * </pre>
 */
public sealed class SmeltException extends RuntimeException
        permits BlockAssemblyException {

    public SmeltException(final String message) {
        super(message);
    }

    public SmeltException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
