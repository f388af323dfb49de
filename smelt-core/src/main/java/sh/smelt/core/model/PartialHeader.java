// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.trie.OrderedTrie;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.Bloom;
import sh.smelt.core.types.Bytes8;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;

/**
 * Header of a block under construction: everything except the ommers hash and
 * the transactions root, which are derived from the block body when the block
 * is assembled.
 *
 * <p>
 * Fork-specific trailing fields are {@code null} when absent. Use
 * {@link #builder()} to fill in only what differs from the defaults.
 *
 * @param parentHash            hash of the parent block
 * @param beneficiary           recipient of priority fees and block rewards
 * @param stateRoot             state trie root after all transactions
 * @param receiptsRoot          receipts trie root
 * @param logsBloom             union of the receipts' blooms
 * @param difficulty            proof-of-work difficulty, zero after the merge
 * @param number                block number
 * @param gasLimit              block gas limit
 * @param gasUsed               gas used by all transactions
 * @param timestamp             seconds since the epoch
 * @param extraData             up to 32 bytes of arbitrary data
 * @param mixHash               proof-of-work mix hash, or prevRandao after the merge
 * @param nonce                 proof-of-work nonce
 * @param baseFeePerGas         London base fee
 * @param withdrawalsRoot       Shanghai withdrawals trie root
 * @param blobGasUsed           Cancun blob gas used
 * @param excessBlobGas         Cancun excess blob gas
 * @param parentBeaconBlockRoot Cancun parent beacon block root
 */
public record PartialHeader(
        Hash parentHash,
        Address beneficiary,
        Hash stateRoot,
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

    public PartialHeader {
        Objects.requireNonNull(parentHash, "parentHash cannot be null");
        Objects.requireNonNull(beneficiary, "beneficiary cannot be null");
        Objects.requireNonNull(stateRoot, "stateRoot cannot be null");
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
    }

    /**
     * Returns a copy with the withdrawals root replaced.
     */
    public PartialHeader withWithdrawalsRoot(final @Nullable Hash root) {
        return new PartialHeader(parentHash, beneficiary, stateRoot, receiptsRoot, logsBloom, difficulty,
                number, gasLimit, gasUsed, timestamp, extraData, mixHash, nonce,
                baseFeePerGas, root, blobGasUsed, excessBlobGas, parentBeaconBlockRoot);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder. Roots default to the empty trie root, everything else to zero
     * or empty, and the fork-specific fields to absent.
     */
    public static final class Builder {
        private Hash parentHash = Hash.ZERO;
        private Address beneficiary = Address.ZERO;
        private Hash stateRoot = OrderedTrie.EMPTY_ROOT;
        private Hash receiptsRoot = OrderedTrie.EMPTY_ROOT;
        private Bloom logsBloom = Bloom.EMPTY;
        private BigInteger difficulty = BigInteger.ZERO;
        private long number;
        private long gasLimit = 30_000_000L;
        private long gasUsed;
        private long timestamp;
        private HexData extraData = HexData.EMPTY;
        private Hash mixHash = Hash.ZERO;
        private Bytes8 nonce = Bytes8.ZERO;
        private Wei baseFeePerGas;
        private Hash withdrawalsRoot;
        private Long blobGasUsed;
        private Long excessBlobGas;
        private Hash parentBeaconBlockRoot;

        private Builder() {
        }

        public Builder parentHash(final Hash parentHash) {
            this.parentHash = parentHash;
            return this;
        }

        public Builder beneficiary(final Address beneficiary) {
            this.beneficiary = beneficiary;
            return this;
        }

        public Builder stateRoot(final Hash stateRoot) {
            this.stateRoot = stateRoot;
            return this;
        }

        public Builder receiptsRoot(final Hash receiptsRoot) {
            this.receiptsRoot = receiptsRoot;
            return this;
        }

        public Builder logsBloom(final Bloom logsBloom) {
            this.logsBloom = logsBloom;
            return this;
        }

        public Builder difficulty(final BigInteger difficulty) {
            this.difficulty = difficulty;
            return this;
        }

        public Builder number(final long number) {
            this.number = number;
            return this;
        }

        public Builder gasLimit(final long gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder gasUsed(final long gasUsed) {
            this.gasUsed = gasUsed;
            return this;
        }

        public Builder timestamp(final long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder extraData(final HexData extraData) {
            this.extraData = extraData;
            return this;
        }

        public Builder mixHash(final Hash mixHash) {
            this.mixHash = mixHash;
            return this;
        }

        public Builder nonce(final Bytes8 nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder baseFeePerGas(final Wei baseFeePerGas) {
            this.baseFeePerGas = baseFeePerGas;
            return this;
        }

        public Builder withdrawalsRoot(final Hash withdrawalsRoot) {
            this.withdrawalsRoot = withdrawalsRoot;
            return this;
        }

        public Builder blobGasUsed(final Long blobGasUsed) {
            this.blobGasUsed = blobGasUsed;
            return this;
        }

        public Builder excessBlobGas(final Long excessBlobGas) {
            this.excessBlobGas = excessBlobGas;
            return this;
        }

        public Builder parentBeaconBlockRoot(final Hash parentBeaconBlockRoot) {
            this.parentBeaconBlockRoot = parentBeaconBlockRoot;
            return this;
        }

        public PartialHeader build() {
            return new PartialHeader(parentHash, beneficiary, stateRoot, receiptsRoot, logsBloom, difficulty,
                    number, gasLimit, gasUsed, timestamp, extraData, mixHash, nonce,
                    baseFeePerGas, withdrawalsRoot, blobGasUsed, excessBlobGas, parentBeaconBlockRoot);
        }
    }
}
