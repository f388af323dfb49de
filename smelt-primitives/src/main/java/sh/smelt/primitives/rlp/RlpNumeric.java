// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives.rlp;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Scalars in RLP: a non-negative integer is the shortest big-endian byte string
 * holding it, with no sign byte, and zero is the empty string. Header numbers,
 * gas values, nonces, wei amounts and trie keys are all written this way.
 */
public final class RlpNumeric {

    private RlpNumeric() {
    }

    /**
     * @return the complete RLP encoding of {@code value}, e.g. {@code 0x80} for zero
     *         and {@code 0x820400} for 1024
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static byte[] encodeLongUnsigned(final long value) {
        return encodeLongUnsignedItem(value).encode();
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpItem encodeLongUnsignedItem(final long value) {
        if (value < 0L) {
            throw new IllegalArgumentException("RLP scalars must be non-negative, got " + value);
        }
        final int length = Long.BYTES - Long.numberOfLeadingZeros(value) / Byte.SIZE;
        final byte[] raw = new byte[length];
        for (int i = 0; i < length; i++) {
            raw[i] = (byte) (value >>> (Byte.SIZE * (length - 1 - i)));
        }
        return new RlpString(raw);
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpItem encodeBigIntegerUnsignedItem(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP scalars must be non-negative, got " + value);
        }
        if (value.bitLength() < Long.SIZE) {
            return encodeLongUnsignedItem(value.longValue());
        }
        final byte[] signed = value.toByteArray();
        // a leading zero byte is only there to keep the two's complement form positive
        if (signed[0] == 0) {
            final byte[] raw = new byte[signed.length - 1];
            System.arraycopy(signed, 1, raw, 0, raw.length);
            return new RlpString(raw);
        }
        return new RlpString(signed);
    }
}
