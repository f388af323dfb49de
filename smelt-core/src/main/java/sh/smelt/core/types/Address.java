// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Hex-encoded 20-byte account address, stored in lowercase.
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public RlpString toRlp() {
        return new RlpString(toBytes());
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }
}
