// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.Objects;

import sh.smelt.core.tx.SignedTransaction;
import sh.smelt.core.types.Address;

/**
 * A transaction of a block viewed together with its sender and receipt.
 * Produced on demand; holds references, not copies.
 *
 * @param transaction the signed transaction
 * @param caller      the address that sent it
 * @param receipt     its receipt within the block
 */
public record DetailedTransaction(SignedTransaction transaction, Address caller, BlockReceipt receipt) {

    public DetailedTransaction {
        Objects.requireNonNull(transaction, "transaction cannot be null");
        Objects.requireNonNull(caller, "caller cannot be null");
        Objects.requireNonNull(receipt, "receipt cannot be null");
    }
}
