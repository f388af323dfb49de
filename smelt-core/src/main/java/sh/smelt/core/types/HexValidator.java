// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for {@code 0x}-prefixed hex strings of an exact byte length.
 * Shared by {@link Address}, {@link Hash} and {@link Bytes8}.
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a pattern matching {@code 0x} followed by {@code byteLength * 2} hex digits
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }
}
