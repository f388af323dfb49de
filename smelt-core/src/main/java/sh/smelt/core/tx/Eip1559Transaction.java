// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.crypto.Signature;
import sh.smelt.core.model.AccessListEntry;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpNumeric;
import sh.smelt.primitives.rlp.RlpString;

/**
 * EIP-1559 transaction with dynamic fee market, EIP-2718 type {@code 0x02}.
 *
 * <p>
 * Signed envelope:
 *
 * <pre>
 * 0x02 || RLP([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas, gasLimit, to, value, data, accessList, yParity, r, s])
 * </pre>
 *
 * @param chainId              the chain ID
 * @param nonce                the transaction nonce
 * @param maxPriorityFeePerGas the maximum priority fee (miner tip)
 * @param maxFeePerGas         the maximum total fee per gas
 * @param gasLimit             the maximum gas to use
 * @param to                   the recipient address (null for contract creation)
 * @param value                the amount of ether to send
 * @param data                 the transaction data
 * @param accessList           the EIP-2930 access list
 */
public record Eip1559Transaction(
        long chainId,
        long nonce,
        Wei maxPriorityFeePerGas,
        Wei maxFeePerGas,
        long gasLimit,
        @Nullable Address to,
        Wei value,
        HexData data,
        List<AccessListEntry> accessList) implements UnsignedTransaction {

    static final int TYPE = 0x02;

    public Eip1559Transaction {
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain ID must be positive");
        }
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        accessList = accessList != null ? List.copyOf(accessList) : List.of();
    }

    @Override
    public int type() {
        return TYPE;
    }

    /**
     * @throws IllegalArgumentException if {@code v} is not a bare y-parity (0 or 1)
     */
    @Override
    public byte[] encodeAsEnvelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (signature.v() != 0 && signature.v() != 1) {
            throw new IllegalArgumentException(
                    "EIP-1559 signature v must be yParity (0 or 1), got: " + signature.v());
        }

        final List<RlpItem> items = new ArrayList<>(12);
        items.add(RlpNumeric.encodeLongUnsignedItem(chainId));
        items.add(RlpNumeric.encodeLongUnsignedItem(nonce));
        items.add(maxPriorityFeePerGas.toRlp());
        items.add(maxFeePerGas.toRlp());
        items.add(RlpNumeric.encodeLongUnsignedItem(gasLimit));
        items.add(to != null ? to.toRlp() : new RlpString(new byte[0]));
        items.add(value.toRlp());
        items.add(data.toRlp());

        final List<RlpItem> entries = new ArrayList<>(accessList.size());
        for (AccessListEntry entry : accessList) {
            entries.add(entry.toRlp());
        }
        items.add(new RlpList(entries));

        items.addAll(signature.toRlpFields());

        final byte[] payload = Rlp.encodeList(items);
        final byte[] result = new byte[payload.length + 1];
        result[0] = (byte) TYPE;
        System.arraycopy(payload, 0, result, 1, payload.length);
        return result;
    }
}
