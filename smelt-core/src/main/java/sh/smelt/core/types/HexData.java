// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Immutable arbitrary-length byte data, rendered as a {@code 0x}-prefixed hex
 * string.
 * <p>
 * Used for calldata, log data and header extra data. Instances built from bytes
 * keep the raw array and render the hex string lazily; instances built from a
 * string validate it eagerly.
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    private static final byte[] NO_BYTES = new byte[0];

    public static final HexData EMPTY = new HexData(NO_BYTES);

    private final byte[] raw;
    private volatile String value;

    /**
     * @param value the hex-encoded string with "0x" prefix
     * @throws IllegalArgumentException if the string is not even-length hex
     */
    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Creates HexData from raw bytes, copying them.
     *
     * @param bytes the byte array, or null/empty for {@link #EMPTY}
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(Arrays.copyOf(bytes, bytes.length));
    }

    @JsonValue
    public String value() {
        String result = value;
        if (result == null) {
            result = Hex.encode(raw);
            value = result;
        }
        return result;
    }

    public int byteLength() {
        return raw.length;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    public RlpString toRlp() {
        return new RlpString(toBytes());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HexData other))
            return false;
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[" + "value=" + value() + ']';
    }
}
