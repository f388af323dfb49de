// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;

/**
 * An event log exactly as emitted during execution, before it is placed in a
 * block.
 *
 * @param address the contract that emitted the log
 * @param topics  the indexed topics (topic 0 is usually the event signature)
 * @param data    the non-indexed payload
 * @see LogEntry
 */
public record Log(Address address, List<Hash> topics, HexData data) {

    public Log {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        topics = List.copyOf(topics);
    }

    /**
     * {@code [address, [topic...], data]}
     */
    public RlpList toRlp() {
        final List<RlpItem> topicItems = new ArrayList<>(topics.size());
        for (Hash topic : topics) {
            topicItems.add(topic.toRlp());
        }
        return RlpList.of(address.toRlp(), new RlpList(topicItems), data.toRlp());
    }
}
