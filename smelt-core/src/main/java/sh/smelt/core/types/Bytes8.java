// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Fixed 8-byte value, used for the proof-of-work nonce in block headers. Unlike a
 * scalar it always encodes all 8 bytes, leading zeros included.
 */
public record Bytes8(@JsonValue String value) {
    private static final int BYTE_LENGTH = 8;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public static final Bytes8 ZERO = new Bytes8("0x0000000000000000");

    public Bytes8 {
        Objects.requireNonNull(value, "bytes8");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid 8-byte value: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Bytes8 of(final long value) {
        return new Bytes8(String.format("0x%016x", value));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public RlpString toRlp() {
        return new RlpString(toBytes());
    }
}
