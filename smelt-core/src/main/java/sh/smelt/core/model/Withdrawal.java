// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.Objects;

import sh.smelt.core.types.Address;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpNumeric;

/**
 * Validator withdrawal pushed by the consensus layer (EIP-4895).
 *
 * @param index          monotonically increasing withdrawal index
 * @param validatorIndex index of the withdrawing validator
 * @param address        recipient of the withdrawn ether
 * @param amount         amount in gwei
 */
public record Withdrawal(long index, long validatorIndex, Address address, long amount) {

    public Withdrawal {
        if (index < 0 || validatorIndex < 0) {
            throw new IllegalArgumentException("withdrawal indices must be non-negative");
        }
        Objects.requireNonNull(address, "address cannot be null");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be non-negative");
        }
    }

    /**
     * {@code [index, validatorIndex, address, amount]}
     */
    public RlpList toRlp() {
        return RlpList.of(
                RlpNumeric.encodeLongUnsignedItem(index),
                RlpNumeric.encodeLongUnsignedItem(validatorIndex),
                address.toRlp(),
                RlpNumeric.encodeLongUnsignedItem(amount));
    }

    public byte[] encode() {
        return toRlp().encode();
    }
}
