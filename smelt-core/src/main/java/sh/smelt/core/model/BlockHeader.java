// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.Bloom;
import sh.smelt.core.types.Bytes8;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * Finalized block header.
 *
 * <p>
 * The RLP form is the 15 original fields followed by the fork-specific fields
 * in activation order: base fee (London), withdrawals root (Shanghai), blob gas
 * used, excess blob gas and parent beacon block root (Cancun). A trailing field
 * may only be present if every field before it is, so the encoding simply stops
 * at the first absent one.
 *
 * <p>
 * The block hash is the Keccak-256 of that encoding. It is recomputed on every
 * {@link #hash()} call; holders that need it repeatedly cache it.
 */
public record BlockHeader(
        Hash parentHash,
        Hash ommersHash,
        Address beneficiary,
        Hash stateRoot,
        Hash transactionsRoot,
        Hash receiptsRoot,
        Bloom logsBloom,
        BigInteger difficulty,
        long number,
        long gasLimit,
        long gasUsed,
        long timestamp,
        HexData extraData,
        Hash mixHash,
        Bytes8 nonce,
        @Nullable Wei baseFeePerGas,
        @Nullable Hash withdrawalsRoot,
        @Nullable Long blobGasUsed,
        @Nullable Long excessBlobGas,
        @Nullable Hash parentBeaconBlockRoot) {

    public BlockHeader {
        Objects.requireNonNull(parentHash, "parentHash cannot be null");
        Objects.requireNonNull(ommersHash, "ommersHash cannot be null");
        Objects.requireNonNull(beneficiary, "beneficiary cannot be null");
        Objects.requireNonNull(stateRoot, "stateRoot cannot be null");
        Objects.requireNonNull(transactionsRoot, "transactionsRoot cannot be null");
        Objects.requireNonNull(receiptsRoot, "receiptsRoot cannot be null");
        Objects.requireNonNull(logsBloom, "logsBloom cannot be null");
        Objects.requireNonNull(difficulty, "difficulty cannot be null");
        Objects.requireNonNull(extraData, "extraData cannot be null");
        Objects.requireNonNull(mixHash, "mixHash cannot be null");
        Objects.requireNonNull(nonce, "nonce cannot be null");
        if (difficulty.signum() < 0) {
            throw new IllegalArgumentException("difficulty must be non-negative");
        }
        if (number < 0 || gasLimit < 0 || gasUsed < 0 || timestamp < 0) {
            throw new IllegalArgumentException("number, gasLimit, gasUsed and timestamp must be non-negative");
        }

        final Object[] trailing = { baseFeePerGas, withdrawalsRoot, blobGasUsed, excessBlobGas, parentBeaconBlockRoot };
        boolean absentSeen = false;
        for (Object field : trailing) {
            if (field == null) {
                absentSeen = true;
            } else if (absentSeen) {
                throw new IllegalArgumentException("fork fields must be set in activation order");
            }
        }
    }

    /**
     * Completes a partial header with the roots derived from the block body.
     *
     * @param partial          the header under construction
     * @param ommersHash       Keccak-256 of the RLP list of ommer headers
     * @param transactionsRoot ordered trie root of the transactions
     * @return the finalized header
     */
    public static BlockHeader fromPartial(final PartialHeader partial, final Hash ommersHash,
            final Hash transactionsRoot) {
        Objects.requireNonNull(partial, "partial cannot be null");
        return new BlockHeader(
                partial.parentHash(),
                ommersHash,
                partial.beneficiary(),
                partial.stateRoot(),
                transactionsRoot,
                partial.receiptsRoot(),
                partial.logsBloom(),
                partial.difficulty(),
                partial.number(),
                partial.gasLimit(),
                partial.gasUsed(),
                partial.timestamp(),
                partial.extraData(),
                partial.mixHash(),
                partial.nonce(),
                partial.baseFeePerGas(),
                partial.withdrawalsRoot(),
                partial.blobGasUsed(),
                partial.excessBlobGas(),
                partial.parentBeaconBlockRoot());
    }

    public RlpList toRlp() {
        final List<RlpItem> items = new ArrayList<>(20);
        items.add(parentHash.toRlp());
        items.add(ommersHash.toRlp());
        items.add(beneficiary.toRlp());
        items.add(stateRoot.toRlp());
        items.add(transactionsRoot.toRlp());
        items.add(receiptsRoot.toRlp());
        items.add(logsBloom.toRlp());
        items.add(RlpNumeric.encodeBigIntegerUnsignedItem(difficulty));
        items.add(RlpNumeric.encodeLongUnsignedItem(number));
        items.add(RlpNumeric.encodeLongUnsignedItem(gasLimit));
        items.add(RlpNumeric.encodeLongUnsignedItem(gasUsed));
        items.add(RlpNumeric.encodeLongUnsignedItem(timestamp));
        items.add(extraData.toRlp());
        items.add(mixHash.toRlp());
        items.add(nonce.toRlp());

        // trailing fields are contiguous, see the constructor
        if (baseFeePerGas != null) {
            items.add(baseFeePerGas.toRlp());
        }
        if (withdrawalsRoot != null) {
            items.add(withdrawalsRoot.toRlp());
        }
        if (blobGasUsed != null) {
            items.add(RlpNumeric.encodeLongUnsignedItem(blobGasUsed));
        }
        if (excessBlobGas != null) {
            items.add(RlpNumeric.encodeLongUnsignedItem(excessBlobGas));
        }
        if (parentBeaconBlockRoot != null) {
            items.add(parentBeaconBlockRoot.toRlp());
        }
        return new RlpList(items);
    }

    public byte[] encode() {
        return toRlp().encode();
    }

    public Hash hash() {
        return Keccak256.digest(encode());
    }
}
