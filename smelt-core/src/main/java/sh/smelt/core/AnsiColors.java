// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

/**
 * ANSI palette for debug output. Colors are empty strings unless stdout is a
 * TTY or {@code FORCE_COLOR=true} is set.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");

    /** Success indicators. */
    public static final String TEAL = ansi("38;5;44");

    /** Block-level operations. */
    public static final String INDIGO = ansi("38;5;99");

    /** Receipt and log operations. */
    public static final String LAVENDER = ansi("38;5;183");

    /** Secondary information such as durations. */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
