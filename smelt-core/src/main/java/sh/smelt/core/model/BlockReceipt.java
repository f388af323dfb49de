// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Bloom;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.Wei;

/**
 * Receipt of a transaction that has been placed in a block.
 *
 * <p>
 * Instances are immutable and meant to be shared: the same receipt is referenced
 * by the block's receipt list, by {@link DetailedTransaction} views and by any
 * external log index, without copying.
 *
 * @param transactionHash   the hash of the executed transaction
 * @param transactionIndex  the position of the transaction in the block
 * @param blockHash         the hash of the containing block
 * @param blockNumber       the number of the containing block
 * @param from              the address that sent the transaction
 * @param to                the recipient address, or null for contract creation
 * @param contractAddress   the deployed contract, or null
 * @param gasUsed           gas used by this transaction alone
 * @param effectiveGasPrice the price per gas actually paid
 * @param cumulativeGasUsed gas used by the block up to and including this transaction
 * @param logsBloom         bloom filter over {@code logs}
 * @param logs              logs with block-wide log indices
 * @param data              status or state root, and the transaction type
 */
public record BlockReceipt(
        Hash transactionHash,
        long transactionIndex,
        Hash blockHash,
        long blockNumber,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        long gasUsed,
        Wei effectiveGasPrice,
        long cumulativeGasUsed,
        Bloom logsBloom,
        List<LogEntry> logs,
        ReceiptData data) {

    public BlockReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(effectiveGasPrice, "effectiveGasPrice cannot be null");
        Objects.requireNonNull(logsBloom, "logsBloom cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (transactionIndex < 0 || blockNumber < 0) {
            throw new IllegalArgumentException("block number and transaction index must be non-negative");
        }
        logs = List.copyOf(logs);
    }

    /**
     * @return {@code true} if the transaction succeeded; pre-Byzantium receipts
     *         carry no status and report {@code true}
     */
    public boolean status() {
        return !(data instanceof ReceiptData.Status status) || status.success();
    }
}
