// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.trie;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.types.Hash;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpNumeric;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Root of a Merkle-Patricia trie keyed by position, as used for the
 * transactions, receipts and withdrawals roots of a block header.
 *
 * <p>
 * The value at position {@code i} is stored under the key {@code rlp(i)}. The
 * trie is built in one pass over the sorted keys:
 * <ul>
 * <li>a single remaining entry becomes a leaf {@code [hp(path, leaf), value]}</li>
 * <li>entries sharing a path prefix get an extension {@code [hp(prefix), child]}</li>
 * <li>otherwise a 17-slot branch, one slot per nibble plus a value slot</li>
 * </ul>
 * A child whose RLP is shorter than 32 bytes is embedded in its parent; longer
 * children are referenced by their Keccak-256 hash. The root is always hashed.
 *
 * <pre>{@code
 * List<byte[]> encoded = transactions.stream().map(SignedTransaction::encode).toList();
 * Hash transactionsRoot = OrderedTrie.root(encoded);
 * }</pre>
 */
public final class OrderedTrie {

    /** Root of the trie with no entries: {@code keccak256(rlp(""))}. */
    public static final Hash EMPTY_ROOT =
            new Hash("0x56e81f171bcc55a6ff8345e692c0f86e5b48e01b996cadc001622fb5e363b421");

    private static final int BRANCH_WIDTH = 16;
    private static final int MAX_INLINE_LENGTH = 32;
    private static final RlpString EMPTY_SLOT = new RlpString(new byte[0]);

    private OrderedTrie() {
    }

    /**
     * Computes the trie root over {@code values} keyed by their index.
     *
     * @param values encoded items in order; neither the list nor its elements may be null
     * @return the 32-byte root
     */
    public static Hash root(final List<byte[]> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return EMPTY_ROOT;
        }

        final List<Entry> entries = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            final byte[] value = Objects.requireNonNull(values.get(i), "values cannot contain null");
            entries.add(new Entry(toNibbles(RlpNumeric.encodeLongUnsigned(i)), value));
        }
        entries.sort(Comparator.comparing(Entry::path, Arrays::compare));

        final RlpItem rootNode = buildNode(entries, 0, entries.size(), 0);
        return Keccak256.digest(rootNode.encode());
    }

    /**
     * Builds the node covering {@code entries[from, to)}, all of which share the
     * first {@code depth} nibbles.
     */
    private static RlpItem buildNode(final List<Entry> entries, final int from, final int to, final int depth) {
        final Entry first = entries.get(from);
        if (to - from == 1) {
            final byte[] remaining = Arrays.copyOfRange(first.path(), depth, first.path().length);
            return RlpList.of(hexPrefix(remaining, true), new RlpString(first.value()));
        }

        // sorted input: the prefix shared by first and last is shared by all
        final byte[] lastPath = entries.get(to - 1).path();
        int shared = 0;
        while (depth + shared < first.path().length
                && depth + shared < lastPath.length
                && first.path()[depth + shared] == lastPath[depth + shared]) {
            shared++;
        }
        if (shared > 0) {
            final byte[] prefix = Arrays.copyOfRange(first.path(), depth, depth + shared);
            return RlpList.of(hexPrefix(prefix, false), reference(buildNode(entries, from, to, depth + shared)));
        }

        final List<RlpItem> slots = new ArrayList<>(BRANCH_WIDTH + 1);
        RlpItem valueSlot = EMPTY_SLOT;
        int cursor = from;
        if (first.path().length == depth) {
            // a key that ends here sorts first and owns the value slot
            valueSlot = new RlpString(first.value());
            cursor++;
        }
        for (int nibble = 0; nibble < BRANCH_WIDTH; nibble++) {
            final int start = cursor;
            while (cursor < to && entries.get(cursor).path()[depth] == nibble) {
                cursor++;
            }
            slots.add(start == cursor ? EMPTY_SLOT : reference(buildNode(entries, start, cursor, depth + 1)));
        }
        slots.add(valueSlot);
        return new RlpList(slots);
    }

    private static RlpItem reference(final RlpItem node) {
        final byte[] encoded = node.encode();
        if (encoded.length < MAX_INLINE_LENGTH) {
            return node;
        }
        return new RlpString(Keccak256.hash(encoded));
    }

    /**
     * Hex-prefix encoding of a nibble path. The high nibble of the first byte
     * holds the flags: bit 1 marks a leaf, bit 0 an odd-length path.
     */
    static RlpString hexPrefix(final byte[] nibbles, final boolean leaf) {
        final boolean odd = (nibbles.length & 1) == 1;
        final int flags = (leaf ? 2 : 0) + (odd ? 1 : 0);
        final byte[] out = new byte[nibbles.length / 2 + 1];

        int n = 0;
        if (odd) {
            out[0] = (byte) ((flags << 4) | nibbles[0]);
            n = 1;
        } else {
            out[0] = (byte) (flags << 4);
        }
        for (int i = 1; i < out.length; i++) {
            out[i] = (byte) ((nibbles[n] << 4) | nibbles[n + 1]);
            n += 2;
        }
        return new RlpString(out);
    }

    static byte[] toNibbles(final byte[] key) {
        final byte[] nibbles = new byte[key.length * 2];
        for (int i = 0; i < key.length; i++) {
            nibbles[i * 2] = (byte) ((key[i] & 0xFF) >>> 4);
            nibbles[i * 2 + 1] = (byte) (key[i] & 0x0F);
        }
        return nibbles;
    }

    private record Entry(byte[] path, byte[] value) {
    }
}
