// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.smelt.primitives.Hex;

/**
 * RLP byte string.
 *
 * <p>The public constructor wraps the array without copying and is meant for
 * callers that own the array (the decoder, numeric helpers, freshly built
 * arrays). The {@code of(...)} factories copy or build new arrays.
 *
 * <p>The encoded form is cached after the first {@link #encode()} call. Races on
 * the cache are benign: concurrent callers compute the same bytes.
 */
public final class RlpString implements RlpItem {

    private final byte[] bytes;

    private volatile byte[] encoded;

    public RlpString(final byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
    }

    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Creates an {@link RlpString} from a hex string with or without {@code 0x} prefix.
     */
    public static RlpString of(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Creates an {@link RlpString} holding the minimal big-endian form of a
     * non-negative scalar. Zero becomes the empty string.
     *
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        return (RlpString) RlpNumeric.encodeLongUnsignedItem(value);
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        return (RlpString) RlpNumeric.encodeBigIntegerUnsignedItem(value);
    }

    /**
     * Returns a copy of the raw payload.
     */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Interprets the payload as an unsigned big-endian integer.
     */
    public BigInteger asBigInteger() {
        return bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
    }

    /**
     * Interprets the payload as an unsigned big-endian {@code long}.
     *
     * @throws IllegalArgumentException if the payload is longer than 8 bytes
     */
    public long asLong() {
        if (bytes.length > 8) {
            throw new IllegalArgumentException("RLP scalar too large for long: " + bytes.length + " bytes");
        }
        long value = 0;
        for (final byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }

    /**
     * The returned array is shared with the cache and must not be mutated.
     */
    @Override
    public byte[] encode() {
        final byte[] cached = encoded;
        if (cached != null) {
            return cached;
        }
        final byte[] result = Rlp.encodeString(bytes);
        encoded = result;
        return result;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(this.bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
