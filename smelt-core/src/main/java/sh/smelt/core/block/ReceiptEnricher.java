// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import sh.smelt.core.DebugLogger;
import sh.smelt.core.LogFormatter;
import sh.smelt.core.model.BlockReceipt;
import sh.smelt.core.model.Log;
import sh.smelt.core.model.LogEntry;
import sh.smelt.core.model.TransactionReceipt;
import sh.smelt.core.types.Hash;

/**
 * Turns the receipts produced while executing a block's transactions into
 * receipts that know their block.
 *
 * <p>
 * Receipt {@code i} gets transaction index {@code i}. Log indices run over the
 * whole block: the first log of the first transaction is {@code 0} and the
 * counter never resets between transactions, so a block with receipts holding
 * 2, 0 and 1 logs numbers them {@code 0, 1} and {@code 2}.
 */
public final class ReceiptEnricher {

    private ReceiptEnricher() {
    }

    /**
     * @param blockHash   hash of the block the receipts belong to
     * @param blockNumber number of that block
     * @param receipts    receipts in transaction order
     * @return an unmodifiable list of block receipts, in the same order
     */
    public static List<BlockReceipt> enrich(
            final Hash blockHash, final long blockNumber, final List<TransactionReceipt> receipts) {
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(receipts, "receipts");

        final List<BlockReceipt> enriched = new ArrayList<>(receipts.size());
        long nextLogIndex = 0;
        for (int i = 0; i < receipts.size(); i++) {
            final TransactionReceipt receipt = receipts.get(i);
            final List<LogEntry> logs = new ArrayList<>(receipt.logs().size());
            for (final Log log : receipt.logs()) {
                logs.add(new LogEntry(
                        log.address(),
                        log.data(),
                        log.topics(),
                        blockHash,
                        blockNumber,
                        receipt.transactionHash(),
                        i,
                        nextLogIndex++,
                        false));
            }
            enriched.add(new BlockReceipt(
                    receipt.transactionHash(),
                    i,
                    blockHash,
                    blockNumber,
                    receipt.from(),
                    receipt.to(),
                    receipt.contractAddress(),
                    receipt.gasUsed(),
                    receipt.effectiveGasPrice(),
                    receipt.cumulativeGasUsed(),
                    receipt.logsBloom(),
                    logs,
                    receipt.data()));
        }

        DebugLogger.logReceipts(LogFormatter.formatReceipts(blockHash.value(), enriched.size(), nextLogIndex));
        return Collections.unmodifiableList(enriched);
    }
}
