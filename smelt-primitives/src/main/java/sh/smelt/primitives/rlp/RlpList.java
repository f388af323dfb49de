// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives.rlp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RLP list of items. Block headers, transactions and the block body are all
 * built from nested {@code RlpList}s.
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        items = Collections.unmodifiableList(new ArrayList<>(items));
        if (items.contains(null)) {
            throw new IllegalArgumentException("items cannot contain null values");
        }
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(Arrays.asList(items));
    }

    public static RlpList of(final List<? extends RlpItem> items) {
        return new RlpList(new ArrayList<>(items));
    }

    public int size() {
        return items.size();
    }

    public RlpItem get(final int index) {
        return items.get(index);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
