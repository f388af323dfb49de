// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.tx;

import java.util.Arrays;
import java.util.Objects;

import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.crypto.Signature;
import sh.smelt.core.types.Hash;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpString;

/**
 * A transaction together with its signature, as included in a block.
 *
 * <p>
 * The canonical bytes ({@link #encode()}) are computed once at construction.
 * They are what the transactions trie stores and what {@link #hash()} is taken
 * over. Inside a block body the same bytes appear as {@link #toRlp()}: the RLP
 * list itself for legacy transactions, or an RLP byte string wrapping the typed
 * envelope.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class SignedTransaction {

    private final UnsignedTransaction transaction;
    private final Signature signature;
    private final byte[] encoded;
    private final Hash hash;

    public SignedTransaction(final UnsignedTransaction transaction, final Signature signature) {
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.encoded = transaction.encodeAsEnvelope(signature);
        this.hash = Keccak256.digest(encoded);
    }

    public UnsignedTransaction transaction() {
        return transaction;
    }

    public Signature signature() {
        return signature;
    }

    /**
     * @return the EIP-2718 type byte, or {@code 0} for legacy transactions
     */
    public int type() {
        return transaction.type();
    }

    public Hash hash() {
        return hash;
    }

    /**
     * @return a copy of the canonical EIP-2718 bytes
     */
    public byte[] encode() {
        return Arrays.copyOf(encoded, encoded.length);
    }

    /**
     * @return this transaction as an item of a block's transaction list
     */
    public RlpItem toRlp() {
        if (transaction.type() == 0) {
            return Rlp.decode(encoded);
        }
        return RlpString.of(encoded);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SignedTransaction other && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "SignedTransaction[type=" + type() + ", hash=" + hash.value() + "]";
    }
}
