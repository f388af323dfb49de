// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.tx;

import sh.smelt.core.crypto.Signature;

/**
 * Transaction body without its signature.
 *
 * <p>
 * Implementations:
 * <ul>
 * <li>{@link LegacyTransaction} - untyped transactions with a single gas price</li>
 * <li>{@link Eip1559Transaction} - type {@code 0x02} dynamic-fee transactions</li>
 * </ul>
 *
 * @see SignedTransaction
 */
public sealed interface UnsignedTransaction permits LegacyTransaction, Eip1559Transaction {

    /**
     * @return the EIP-2718 type byte, or {@code 0} for legacy transactions
     */
    int type();

    /**
     * Encodes the signed transaction in its canonical EIP-2718 form.
     *
     * <p>
     * Legacy: {@code RLP([nonce, gasPrice, gasLimit, to, value, data, v, r, s])}
     * <br>
     * EIP-1559: {@code 0x02 || RLP([chainId, nonce, maxPriorityFee, maxFee, gasLimit,
     * to, value, data, accessList, yParity, r, s])}
     *
     * @param signature the signature to include
     * @return canonical transaction bytes
     */
    byte[] encodeAsEnvelope(Signature signature);
}
