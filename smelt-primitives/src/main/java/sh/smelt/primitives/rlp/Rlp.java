// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives.rlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix (RLP) encoding and decoding.
 *
 * <p>Decoding is strict: trailing bytes, truncated payloads and non-minimal
 * long-form length prefixes are rejected, so every accepted input has exactly
 * one encoding.
 *
 * @see <a href=
 *      "https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">
 *      Ethereum RLP documentation</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;

    private Rlp() {
        // Utility class
    }

    /**
     * Encodes the provided item to RLP bytes.
     *
     * @param item the item to encode
     * @return encoded bytes
     */
    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes the provided byte string.
     *
     * @param bytes the raw bytes to encode
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");

        final int length = bytes.length;

        // single byte below 0x80 is its own encoding
        if (length == 1 && (bytes[0] & 0xFF) <= 0x7F) {
            return new byte[] { bytes[0] };
        }

        final byte[] result = allocateWithHeader(0x80, 0xB7, length);
        System.arraycopy(bytes, 0, result, result.length - length, length);
        return result;
    }

    /**
     * Encodes the provided items as an RLP list.
     *
     * @param items the items to encode
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<? extends RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final int itemCount = items.size();
        if (itemCount == 0) {
            return new byte[] { (byte) 0xC0 };
        }

        final byte[][] encodedItems = new byte[itemCount][];
        int payloadSize = 0;
        for (int i = 0; i < itemCount; i++) {
            final RlpItem item = items.get(i);
            Objects.requireNonNull(item, "items cannot contain null values");
            encodedItems[i] = item.encode();
            payloadSize += encodedItems[i].length;
        }

        final byte[] result = allocateWithHeader(0xC0, 0xF7, payloadSize);
        int offset = result.length - payloadSize;
        for (final byte[] encoded : encodedItems) {
            System.arraycopy(encoded, 0, result, offset, encoded.length);
            offset += encoded.length;
        }
        return result;
    }

    /**
     * Decodes the provided RLP bytes into a single {@link RlpItem}.
     *
     * @param encoded the encoded bytes
     * @return decoded item
     * @throws IllegalArgumentException if the input is not exactly one canonical item
     */
    public static RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final DecodeResult result = decode(encoded, 0);
        if (result.consumed != encoded.length) {
            throw new IllegalArgumentException("RLP data has trailing bytes");
        }
        return result.item;
    }

    /**
     * Decodes the provided RLP bytes, expecting a list at the root.
     *
     * @param encoded the encoded bytes representing a list
     * @return decoded list items
     */
    public static List<RlpItem> decodeList(final byte[] encoded) {
        final RlpItem item = decode(encoded);
        if (item instanceof RlpList list) {
            return list.items();
        }
        throw new IllegalArgumentException("RLP data is not a list");
    }

    private static DecodeResult decode(final byte[] data, final int offset) {
        if (offset >= data.length) {
            throw new IllegalArgumentException("Invalid RLP data: offset beyond end");
        }

        final int prefix = data[offset] & 0xFF;

        if (prefix <= 0x7F) {
            return new DecodeResult(new RlpString(new byte[] { (byte) prefix }), 1);
        }
        if (prefix <= 0xB7) {
            final int length = prefix - 0x80;
            if (length == 1 && offset + 1 < data.length && (data[offset + 1] & 0xFF) <= 0x7F) {
                throw new IllegalArgumentException("Non-canonical single byte string");
            }
            return decodeString(data, offset, length, 1);
        }
        if (prefix <= 0xBF) {
            final int lengthOfLength = prefix - 0xB7;
            final int length = readLongFormLength(data, offset, lengthOfLength);
            return decodeString(data, offset, length, 1 + lengthOfLength);
        }
        if (prefix <= 0xF7) {
            return decodeList(data, offset, prefix - 0xC0, 1);
        }
        final int lengthOfLength = prefix - 0xF7;
        final int length = readLongFormLength(data, offset, lengthOfLength);
        return decodeList(data, offset, length, 1 + lengthOfLength);
    }

    private static DecodeResult decodeString(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        if (start + length > data.length || start + length < 0) {
            throw new IllegalArgumentException("Invalid RLP string length");
        }

        final byte[] value = new byte[length];
        System.arraycopy(data, start, value, 0, length);
        return new DecodeResult(new RlpString(value), headerSize + length);
    }

    private static DecodeResult decodeList(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        final int end = start + length;
        if (end > data.length || end < 0) {
            throw new IllegalArgumentException("Invalid RLP list length");
        }

        final List<RlpItem> items = new ArrayList<>();
        int cursor = start;
        while (cursor < end) {
            final DecodeResult child = decode(data, cursor);
            items.add(child.item);
            cursor += child.consumed;
        }
        if (cursor != end) {
            throw new IllegalArgumentException("RLP list length mismatch");
        }
        return new DecodeResult(new RlpList(items), headerSize + length);
    }

    /**
     * Reads the big-endian length that follows a long-form prefix and rejects
     * encodings that should have used the short form.
     */
    private static int readLongFormLength(final byte[] data, final int offset, final int lengthOfLength) {
        if (lengthOfLength < 1 || lengthOfLength > 4) {
            throw new IllegalArgumentException("Invalid length-of-length: " + lengthOfLength);
        }
        final int start = offset + 1;
        if (start + lengthOfLength > data.length) {
            throw new IllegalArgumentException("Invalid RLP long length prefix");
        }
        if (data[start] == 0) {
            throw new IllegalArgumentException("Length has leading zeros");
        }

        long length = 0;
        for (int i = 0; i < lengthOfLength; i++) {
            length = (length << 8) | (data[start + i] & 0xFF);
        }
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("RLP length exceeds supported range: " + length);
        }
        if (length <= SHORT_LIMIT) {
            throw new IllegalArgumentException("Non-minimal length encoding");
        }
        return (int) length;
    }

    /**
     * Allocates the output array and writes the header for a payload of
     * {@code payloadSize} bytes. The payload region is left at the tail.
     */
    private static byte[] allocateWithHeader(final int shortBase, final int longBase, final int payloadSize) {
        if (payloadSize <= SHORT_LIMIT) {
            final byte[] result = new byte[1 + payloadSize];
            result[0] = (byte) (shortBase + payloadSize);
            return result;
        }

        final int lengthSize = lengthSize(payloadSize);
        final byte[] result = new byte[1 + lengthSize + payloadSize];
        result[0] = (byte) (longBase + lengthSize);
        int value = payloadSize;
        for (int i = lengthSize; i >= 1; i--) {
            result[i] = (byte) value;
            value >>>= 8;
        }
        return result;
    }

    private static int lengthSize(final int value) {
        if (value < 0x100) {
            return 1;
        }
        if (value < 0x10000) {
            return 2;
        }
        if (value < 0x1000000) {
            return 3;
        }
        return 4;
    }

    private record DecodeResult(RlpItem item, int consumed) {
    }
}
