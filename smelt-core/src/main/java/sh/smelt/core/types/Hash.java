// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Hex-encoded 32-byte hash (Keccak-256).
 * <p>
 * Used for block hashes, transaction hashes, trie roots and log topics. The
 * value must be {@code 0x} followed by exactly 64 hex characters and is stored
 * in lowercase.
 */
public record Hash(@JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The all-zero hash. */
    public static final Hash ZERO = new Hash("0x" + "0".repeat(BYTE_LENGTH * 2));

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public RlpString toRlp() {
        return new RlpString(toBytes());
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }
}
