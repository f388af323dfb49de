// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.block;

import static org.junit.jupiter.api.Assertions.*;
import static sh.smelt.core.block.BlockFixtures.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.smelt.core.model.BlockReceipt;
import sh.smelt.core.model.LogEntry;
import sh.smelt.core.model.TransactionReceipt;
import sh.smelt.core.tx.SignedTransaction;
import sh.smelt.core.types.Hash;

class ReceiptEnricherTest {

    private static final Hash BLOCK_HASH = new Hash("0x" + "f".repeat(64));

    @Test
    @DisplayName("log indices run across the whole block")
    void assignsBlockWideLogIndices() {
        final List<SignedTransaction> txs = twoTransactions();
        final List<BlockReceipt> receipts = ReceiptEnricher.enrich(BLOCK_HASH, 7L, receiptsFor(txs));

        assertEquals(2, receipts.size());
        assertEquals(List.of(0L, 1L), receipts.get(0).logs().stream().map(LogEntry::logIndex).toList());
        assertEquals(List.of(2L), receipts.get(1).logs().stream().map(LogEntry::logIndex).toList());
    }

    @Test
    void counterDoesNotResetAfterReceiptWithoutLogs() {
        final SignedTransaction first = legacyTransfer(0);
        final SignedTransaction second = legacyTransfer(1);
        final SignedTransaction third = legacyTransfer(2);
        final List<TransactionReceipt> raw = List.of(
                receipt(first, 21_000L, 21_000L, List.of(transferLog(1))),
                receipt(second, 21_000L, 42_000L, List.of()),
                receipt(third, 21_000L, 63_000L, List.of(transferLog(2), transferLog(3))));

        final List<BlockReceipt> receipts = ReceiptEnricher.enrich(BLOCK_HASH, 7L, raw);

        assertEquals(0L, receipts.get(0).logs().get(0).logIndex());
        assertTrue(receipts.get(1).logs().isEmpty());
        assertEquals(1L, receipts.get(2).logs().get(0).logIndex());
        assertEquals(2L, receipts.get(2).logs().get(1).logIndex());
    }

    @Test
    void stampsBlockContextOnReceiptsAndLogs() {
        final List<SignedTransaction> txs = twoTransactions();
        final List<BlockReceipt> receipts = ReceiptEnricher.enrich(BLOCK_HASH, 7L, receiptsFor(txs));

        for (int i = 0; i < receipts.size(); i++) {
            final BlockReceipt receipt = receipts.get(i);
            assertEquals(BLOCK_HASH, receipt.blockHash());
            assertEquals(7L, receipt.blockNumber());
            assertEquals(i, receipt.transactionIndex());
            assertEquals(txs.get(i).hash(), receipt.transactionHash());
            for (LogEntry log : receipt.logs()) {
                assertEquals(BLOCK_HASH, log.blockHash());
                assertEquals(7L, log.blockNumber());
                assertEquals(i, log.transactionIndex());
                assertEquals(txs.get(i).hash(), log.transactionHash());
                assertFalse(log.removed());
            }
        }
    }

    @Test
    void copiesExecutionFields() {
        final List<SignedTransaction> txs = twoTransactions();
        final List<TransactionReceipt> raw = receiptsFor(txs);
        final BlockReceipt enriched = ReceiptEnricher.enrich(BLOCK_HASH, 7L, raw).get(1);
        final TransactionReceipt source = raw.get(1);

        assertEquals(source.from(), enriched.from());
        assertEquals(source.to(), enriched.to());
        assertNull(enriched.contractAddress());
        assertEquals(source.gasUsed(), enriched.gasUsed());
        assertEquals(source.cumulativeGasUsed(), enriched.cumulativeGasUsed());
        assertEquals(source.effectiveGasPrice(), enriched.effectiveGasPrice());
        assertEquals(source.logsBloom(), enriched.logsBloom());
        assertEquals(source.data(), enriched.data());
        assertTrue(enriched.status());
        assertEquals(source.logs(), enriched.logs().stream().map(LogEntry::toLog).toList());
    }

    @Test
    void emptyInputGivesEmptyList() {
        assertTrue(ReceiptEnricher.enrich(BLOCK_HASH, 0L, List.of()).isEmpty());
    }

    @Test
    void resultIsUnmodifiable() {
        final List<BlockReceipt> receipts =
                ReceiptEnricher.enrich(BLOCK_HASH, 7L, receiptsFor(twoTransactions()));
        assertThrows(UnsupportedOperationException.class, () -> receipts.remove(0));
    }
}
