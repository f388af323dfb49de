// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.smelt.core.model.BlockHeader;
import sh.smelt.core.model.Withdrawal;
import sh.smelt.core.tx.SignedTransaction;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;

/**
 * Canonical wire form of a {@link LocalBlock}.
 *
 * <pre>
 * [header, [tx...], [ommer...]]                   without withdrawals
 * [header, [tx...], [ommer...], [withdrawal...]]  with withdrawals
 * </pre>
 *
 * An empty withdrawals list still produces the fourth element.
 */
public final class BlockEncoder {

    private BlockEncoder() {
    }

    public static RlpList toRlp(final LocalBlock block) {
        Objects.requireNonNull(block, "block");

        final List<RlpItem> transactions = new ArrayList<>(block.transactions().size());
        for (final SignedTransaction transaction : block.transactions()) {
            transactions.add(transaction.toRlp());
        }
        final List<RlpItem> ommers = new ArrayList<>(block.ommers().size());
        for (final BlockHeader ommer : block.ommers()) {
            ommers.add(ommer.toRlp());
        }

        final List<RlpItem> items = new ArrayList<>(4);
        items.add(block.header().toRlp());
        items.add(new RlpList(transactions));
        items.add(new RlpList(ommers));
        block.withdrawals().ifPresent(withdrawals -> {
            final List<RlpItem> encoded = new ArrayList<>(withdrawals.size());
            for (final Withdrawal withdrawal : withdrawals) {
                encoded.add(withdrawal.toRlp());
            }
            items.add(new RlpList(encoded));
        });
        return new RlpList(items);
    }

    public static byte[] encode(final LocalBlock block) {
        return toRlp(block).encode();
    }
}
