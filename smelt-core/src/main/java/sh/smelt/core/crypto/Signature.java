// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * ECDSA signature as carried in a signed transaction.
 *
 * <p>
 * Legacy EIP-155 transactions store {@code v = chainId * 2 + 35 + yParity}; typed
 * transactions store the bare y-parity. Block assembly never recovers or checks a
 * signature, it only serializes one.
 *
 * @param r 32-byte big-endian {@code r}
 * @param s 32-byte big-endian {@code s}
 * @param v recovery value as written on the wire
 */
public record Signature(byte[] r, byte[] s, long v) {

    private static final int COMPONENT_LENGTH = 32;

    public Signature {
        r = component("r", r);
        s = component("s", s);
        if (v < 0) {
            throw new IllegalArgumentException("v cannot be negative: " + v);
        }
    }

    private static byte[] component(final String name, final byte[] value) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException(name + " must be 32 bytes, got " + value.length);
        }
        return value.clone();
    }

    @Override
    public byte[] r() {
        return r.clone();
    }

    @Override
    public byte[] s() {
        return s.clone();
    }

    public BigInteger rAsBigInteger() {
        return new BigInteger(1, r);
    }

    public BigInteger sAsBigInteger() {
        return new BigInteger(1, s);
    }

    /**
     * @return the trailing {@code [v, r, s]} fields of a signed transaction, with
     *         {@code r} and {@code s} as minimal scalars
     */
    public List<RlpItem> toRlpFields() {
        return List.of(
                RlpNumeric.encodeLongUnsignedItem(v),
                RlpNumeric.encodeBigIntegerUnsignedItem(rAsBigInteger()),
                RlpNumeric.encodeBigIntegerUnsignedItem(sAsBigInteger()));
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof Signature other
                && v == other.v
                && Arrays.equals(r, other.r)
                && Arrays.equals(s, other.s);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(r) + Arrays.hashCode(s)) + Long.hashCode(v);
    }

    // r and s are left out; 64 hex digits each only clutter log lines
    @Override
    public String toString() {
        return "Signature[v=" + v + "]";
    }
}
