// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.List;
import java.util.Objects;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;

/**
 * An event log placed in a block, carrying the identifiers log filters and RPC
 * consumers need.
 *
 * @param address          the address of the contract that emitted the log
 * @param data             the non-indexed log data (may be empty)
 * @param topics           the indexed log topics (may be empty)
 * @param blockHash        the hash of the block containing this log
 * @param blockNumber      the number of the block containing this log
 * @param transactionHash  the hash of the transaction that generated this log
 * @param transactionIndex the position of that transaction in the block
 * @param logIndex         the position of this log among all logs of the block
 * @param removed          true if this log was removed due to a chain reorganization
 */
public record LogEntry(
        Address address,
        HexData data,
        List<Hash> topics,
        Hash blockHash,
        long blockNumber,
        Hash transactionHash,
        long transactionIndex,
        long logIndex,
        boolean removed) {

    /**
     * @throws NullPointerException     if a hash, the address, data or topics is null
     * @throws IllegalArgumentException if a number or index is negative
     */
    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        if (blockNumber < 0 || transactionIndex < 0 || logIndex < 0) {
            throw new IllegalArgumentException("block number and indices must be non-negative");
        }
        topics = List.copyOf(topics);
    }

    /**
     * @return the log as emitted, without block context
     */
    public Log toLog() {
        return new Log(address, topics, data);
    }
}
