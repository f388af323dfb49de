// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * Non-negative quantity of wei (10^-18 ether). Also used for gas prices and
 * the header's base fee.
 */
public record Wei(BigInteger value) {
    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    public RlpItem toRlp() {
        return RlpNumeric.encodeBigIntegerUnsignedItem(value);
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
