// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives;

/**
 * Hex conversion for the {@code 0x}-prefixed strings that hashes, addresses and
 * payloads are written as. Output is always lowercase; input may use either
 * case and may omit the prefix.
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix. {@code "0x"} and
     * {@code ""} decode to an empty array.
     *
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  digits or contains a non-hex character
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int offset = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - offset;
        if ((digits & 1) != 0) {
            throw new IllegalArgumentException("hex string must have an even number of digits: " + hex);
        }

        final byte[] out = new byte[digits / 2];
        for (int i = 0, c = offset; i < out.length; i++, c += 2) {
            out[i] = (byte) ((digit(hex, c) << 4) | digit(hex, c + 1));
        }
        return out;
    }

    /**
     * @return {@code 0x} followed by two lowercase digits per byte
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * @return two lowercase digits per byte, no prefix
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] out = new char[bytes.length * 2];
        int c = 0;
        for (final byte b : bytes) {
            out[c++] = DIGITS[(b >> 4) & 0x0F];
            out[c++] = DIGITS[b & 0x0F];
        }
        return new String(out);
    }

    /**
     * @return {@code true} if {@code hex} starts with {@code 0x} or {@code 0X}
     */
    public static boolean hasPrefix(final String hex) {
        return hex != null && hex.length() >= 2 && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    private static int digit(final String hex, final int index) {
        final int value = Character.digit(hex.charAt(index), 16);
        // Character.digit also accepts non-ASCII digits
        if (value < 0 || hex.charAt(index) > 'f') {
            throw new IllegalArgumentException("invalid hex character at " + index + " in: " + hex);
        }
        return value;
    }
}
