// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.block;

import java.util.List;
import java.util.Optional;

import sh.smelt.core.model.BlockHeader;
import sh.smelt.core.model.BlockReceipt;
import sh.smelt.core.model.Withdrawal;
import sh.smelt.core.tx.SignedTransaction;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;

/**
 * Read-only view of an assembled block.
 *
 * <p>
 * The transaction, caller and receipt lists are aligned by index: entry
 * {@code i} of each describes the same transaction.
 */
public interface Block {

    /**
     * @return the block hash, equal to {@code header().hash()}
     */
    Hash hash();

    BlockHeader header();

    List<SignedTransaction> transactions();

    /**
     * @return the sender of each transaction, in transaction order
     */
    List<Address> transactionCallers();

    /**
     * Returns the shared receipt instances. Callers may keep references to them;
     * they are never copied.
     */
    List<BlockReceipt> transactionReceipts();

    List<Hash> ommerHashes();

    /**
     * @return the withdrawals, or empty for blocks from before withdrawals existed
     */
    Optional<List<Withdrawal>> withdrawals();

    /**
     * @return the length in bytes of the canonical encoding; computed on each call
     */
    long rlpSize();
}
