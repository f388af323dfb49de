// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Bloom;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Tests for TransactionReceipt validation and consensus encoding.
 */
class TransactionReceiptTest {

    private static final Hash VALID_HASH = new Hash("0x" + "a".repeat(64));
    private static final Address VALID_ADDRESS = new Address("0x" + "b".repeat(40));
    private static final Wei VALID_GAS_PRICE = Wei.gwei(3);

    private static TransactionReceipt receipt(final List<Log> logs, final ReceiptData data) {
        return new TransactionReceipt(VALID_HASH, VALID_ADDRESS, VALID_ADDRESS, null,
                21_000L, VALID_GAS_PRICE, 42_000L, Bloom.of(logs), logs, data);
    }

    @Test
    void allowsNullToForContractCreation() {
        final Address deployed = new Address("0x" + "c".repeat(40));
        final TransactionReceipt receipt = new TransactionReceipt(VALID_HASH, VALID_ADDRESS, null, deployed,
                50_000L, VALID_GAS_PRICE, 50_000L, Bloom.EMPTY, List.of(), new ReceiptData.Status(0, true));

        assertNull(receipt.to());
        assertEquals(deployed, receipt.contractAddress());
    }

    @Test
    void logsAreCopied() {
        final List<Log> logs = new ArrayList<>();
        logs.add(new Log(VALID_ADDRESS, List.of(), HexData.EMPTY));
        final TransactionReceipt receipt = receipt(logs, new ReceiptData.Status(0, true));

        logs.clear();

        assertEquals(1, receipt.logs().size());
    }

    @Test
    void rejectsNegativeGas() {
        assertThrows(IllegalArgumentException.class, () -> new TransactionReceipt(VALID_HASH, VALID_ADDRESS,
                null, null, -1L, VALID_GAS_PRICE, 0L, Bloom.EMPTY, List.of(), new ReceiptData.Status(0, true)));
    }

    @Test
    void legacyEncodingIsPlainList() {
        final Log log = new Log(VALID_ADDRESS, List.of(VALID_HASH), new HexData("0x01"));
        final TransactionReceipt receipt = receipt(List.of(log), new ReceiptData.Status(0, true));

        final List<RlpItem> fields = Rlp.decodeList(receipt.encode());

        assertEquals(4, fields.size());
        assertEquals(1L, ((RlpString) fields.get(0)).asLong());
        assertEquals(42_000L, ((RlpString) fields.get(1)).asLong());
        assertArrayEquals(Bloom.of(List.of(log)).toBytes(), ((RlpString) fields.get(2)).bytes());
        assertEquals(log.toRlp(), ((RlpList) fields.get(3)).get(0));
    }

    @Test
    void typedEncodingIsPrefixed() {
        final TransactionReceipt receipt = receipt(List.of(), new ReceiptData.Status(2, false));
        final byte[] encoded = receipt.encode();

        assertEquals(0x02, encoded[0]);
        final byte[] payload = new byte[encoded.length - 1];
        System.arraycopy(encoded, 1, payload, 0, payload.length);
        final List<RlpItem> fields = Rlp.decodeList(payload);
        assertEquals(0, ((RlpString) fields.get(0)).bytes().length);
    }

    @Test
    void preByzantiumEncodingCarriesStateRoot() {
        final Hash stateRoot = new Hash("0x" + "e".repeat(64));
        final TransactionReceipt receipt = receipt(List.of(), new ReceiptData.StateRoot(stateRoot));

        final List<RlpItem> fields = Rlp.decodeList(receipt.encode());

        assertEquals(stateRoot.toRlp(), fields.get(0));
    }

    @Test
    void rejectsOutOfRangeType() {
        assertThrows(IllegalArgumentException.class, () -> new ReceiptData.Status(0x80, true));
    }
}
