// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.Objects;

import sh.smelt.core.types.Hash;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * Outcome of a transaction as recorded in its receipt, together with the type
 * of the transaction that produced it.
 *
 * <p>
 * Before Byzantium (EIP-658) receipts carried the intermediate state root;
 * afterwards they carry a success flag.
 */
public sealed interface ReceiptData permits ReceiptData.StateRoot, ReceiptData.Status {

    /**
     * @return the EIP-2718 type of the transaction, {@code 0} for legacy
     */
    int transactionType();

    /**
     * @return the first field of the consensus receipt encoding
     */
    RlpItem outcomeRlp();

    /**
     * Pre-Byzantium outcome. Only legacy transactions existed then.
     *
     * @param stateRoot the state root after the transaction
     */
    record StateRoot(Hash stateRoot) implements ReceiptData {
        public StateRoot {
            Objects.requireNonNull(stateRoot, "stateRoot cannot be null");
        }

        @Override
        public int transactionType() {
            return 0;
        }

        @Override
        public RlpItem outcomeRlp() {
            return stateRoot.toRlp();
        }
    }

    /**
     * @param transactionType the EIP-2718 type, {@code 0} for legacy
     * @param success         {@code true} if execution succeeded, {@code false} if reverted
     */
    record Status(int transactionType, boolean success) implements ReceiptData {
        public Status {
            if (transactionType < 0 || transactionType > 0x7F) {
                throw new IllegalArgumentException("Invalid transaction type: " + transactionType);
            }
        }

        @Override
        public RlpItem outcomeRlp() {
            return RlpNumeric.encodeLongUnsignedItem(success ? 1 : 0);
        }
    }
}
