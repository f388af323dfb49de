// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Bloom;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * Receipt produced by executing one transaction, before the transaction is
 * placed in a block. It knows nothing of block hash, block number or positions;
 * those are added when the block is assembled.
 *
 * <p>
 * <strong>Contract deployment:</strong> if {@code to} is null the transaction
 * created a contract and {@code contractAddress} holds its address.
 *
 * @param transactionHash   the hash of the executed transaction
 * @param from              the address that sent the transaction
 * @param to                the recipient address, or null for contract creation
 * @param contractAddress   the deployed contract, or null for non-deployment transactions
 * @param gasUsed           gas used by this transaction alone
 * @param effectiveGasPrice the price per gas actually paid
 * @param cumulativeGasUsed gas used by all transactions up to and including this
 *                          one in the block
 * @param logsBloom         bloom filter over {@code logs}
 * @param logs              logs in emission order
 * @param data              status or state root, and the transaction type
 * @see BlockReceipt
 */
public record TransactionReceipt(
        Hash transactionHash,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        long gasUsed,
        Wei effectiveGasPrice,
        long cumulativeGasUsed,
        Bloom logsBloom,
        List<Log> logs,
        ReceiptData data) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(effectiveGasPrice, "effectiveGasPrice cannot be null");
        Objects.requireNonNull(logsBloom, "logsBloom cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (gasUsed < 0 || cumulativeGasUsed < 0) {
            throw new IllegalArgumentException("gas values must be non-negative");
        }
        logs = List.copyOf(logs);
    }

    /**
     * Consensus encoding, the value stored in a block's receipts trie:
     * {@code RLP([outcome, cumulativeGasUsed, logsBloom, [log...]])}, prefixed with
     * the type byte for typed transactions.
     */
    public byte[] encode() {
        final List<RlpItem> logItems = new ArrayList<>(logs.size());
        for (Log log : logs) {
            logItems.add(log.toRlp());
        }
        final byte[] payload = Rlp.encodeList(List.of(
                data.outcomeRlp(),
                RlpNumeric.encodeLongUnsignedItem(cumulativeGasUsed),
                logsBloom.toRlp(),
                new RlpList(logItems)));

        if (data.transactionType() == 0) {
            return payload;
        }
        final byte[] typed = new byte[payload.length + 1];
        typed[0] = (byte) data.transactionType();
        System.arraycopy(payload, 0, typed, 1, payload.length);
        return typed;
    }
}
