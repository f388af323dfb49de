// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.crypto.Signature;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpNumeric;
import sh.smelt.primitives.rlp.RlpString;

/**
 * Untyped transaction with a single {@code gasPrice}.
 *
 * <p>
 * Signed envelope: {@code RLP([nonce, gasPrice, gasLimit, to, value, data, v, r, s])}
 * where {@code v} is either 27/28 (pre-EIP-155) or
 * {@code chainId * 2 + 35 + yParity}.
 *
 * @param nonce    the transaction nonce
 * @param gasPrice the gas price in wei
 * @param gasLimit the maximum gas to use
 * @param to       the recipient address (null for contract creation)
 * @param value    the amount of ether to send
 * @param data     the transaction data (calldata or contract bytecode)
 */
public record LegacyTransaction(
        long nonce,
        Wei gasPrice,
        long gasLimit,
        @Nullable Address to,
        Wei value,
        HexData data) implements UnsignedTransaction {

    public LegacyTransaction {
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
    }

    @Override
    public int type() {
        return 0;
    }

    /**
     * @throws IllegalArgumentException if {@code v} is neither 27/28 nor EIP-155 encoded
     */
    @Override
    public byte[] encodeAsEnvelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");

        final long v = signature.v();
        if (v != 27 && v != 28 && v < 35) {
            throw new IllegalArgumentException(
                    "Legacy transaction signature v must be 27, 28 or EIP-155 encoded (>= 35), got: " + v);
        }

        final List<RlpItem> items = new ArrayList<>(9);
        items.add(RlpNumeric.encodeLongUnsignedItem(nonce));
        items.add(gasPrice.toRlp());
        items.add(RlpNumeric.encodeLongUnsignedItem(gasLimit));
        items.add(to != null ? to.toRlp() : new RlpString(new byte[0]));
        items.add(value.toRlp());
        items.add(data.toRlp());
        items.addAll(signature.toRlpFields());

        return Rlp.encodeList(items);
    }
}
