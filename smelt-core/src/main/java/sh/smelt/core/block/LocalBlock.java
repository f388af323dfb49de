// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.jspecify.annotations.Nullable;

import sh.smelt.core.DebugLogger;
import sh.smelt.core.LogFormatter;
import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.error.BlockAssemblyException;
import sh.smelt.core.model.BlockHeader;
import sh.smelt.core.model.BlockReceipt;
import sh.smelt.core.model.DetailedTransaction;
import sh.smelt.core.model.PartialHeader;
import sh.smelt.core.model.TransactionReceipt;
import sh.smelt.core.model.Withdrawal;
import sh.smelt.core.trie.OrderedTrie;
import sh.smelt.core.tx.SignedTransaction;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;

/**
 * A block mined locally from the results of executing its transactions.
 *
 * <p>
 * Construction finalizes the header: the ommers hash, the transactions root
 * and, when withdrawals are given, the withdrawals root are derived from the
 * body and written into the partial header. The block hash is then taken over
 * the finished header and stamped into every receipt and log.
 *
 * <pre>{@code
 * LocalBlock block = new LocalBlock(partialHeader, transactions, callers, receipts, List.of(), List.of());
 * byte[] wire = BlockEncoder.encode(block);
 * }</pre>
 *
 * <p>
 * Instances are immutable and safe to share between threads. The hash is
 * computed once; the receipts handed out by {@link #transactionReceipts()} are
 * the same instances on every call.
 */
public final class LocalBlock implements Block {

    private final BlockHeader header;
    private final Hash hash;
    private final List<SignedTransaction> transactions;
    private final List<Address> transactionCallers;
    private final List<BlockReceipt> transactionReceipts;
    private final List<BlockHeader> ommers;
    private final List<Hash> ommerHashes;
    private final @Nullable List<Withdrawal> withdrawals;

    /**
     * Assembles a block.
     *
     * @param partialHeader      header without ommers hash and transactions root
     * @param transactions       transactions in block order
     * @param transactionCallers sender of each transaction
     * @param receipts           execution receipt of each transaction
     * @param ommers             ommer headers, usually empty
     * @param withdrawals        withdrawals, or null for blocks from before withdrawals
     *                           existed; an empty list is not the same as null
     * @throws BlockAssemblyException if transactions, callers and receipts differ in
     *                                length
     */
    public LocalBlock(
            final PartialHeader partialHeader,
            final List<SignedTransaction> transactions,
            final List<Address> transactionCallers,
            final List<TransactionReceipt> receipts,
            final List<BlockHeader> ommers,
            final @Nullable List<Withdrawal> withdrawals) {
        Objects.requireNonNull(partialHeader, "partialHeader");
        Objects.requireNonNull(transactions, "transactions");
        Objects.requireNonNull(transactionCallers, "transactionCallers");
        Objects.requireNonNull(receipts, "receipts");
        Objects.requireNonNull(ommers, "ommers");
        if (transactions.size() != transactionCallers.size() || transactions.size() != receipts.size()) {
            throw new BlockAssemblyException(transactions.size(), transactionCallers.size(), receipts.size());
        }

        final long start = System.nanoTime();

        this.transactions = List.copyOf(transactions);
        this.transactionCallers = List.copyOf(transactionCallers);
        this.ommers = List.copyOf(ommers);
        this.withdrawals = withdrawals != null ? List.copyOf(withdrawals) : null;

        final List<Hash> hashes = new ArrayList<>(this.ommers.size());
        final List<RlpItem> ommerItems = new ArrayList<>(this.ommers.size());
        for (final BlockHeader ommer : this.ommers) {
            hashes.add(ommer.hash());
            ommerItems.add(ommer.toRlp());
        }
        this.ommerHashes = List.copyOf(hashes);
        final Hash ommersHash = Keccak256.digest(Rlp.encodeList(ommerItems));

        final List<byte[]> encodedTransactions = new ArrayList<>(this.transactions.size());
        for (final SignedTransaction transaction : this.transactions) {
            encodedTransactions.add(transaction.encode());
        }
        final Hash transactionsRoot = OrderedTrie.root(encodedTransactions);

        PartialHeader completed = partialHeader;
        if (this.withdrawals != null) {
            final List<byte[]> encodedWithdrawals = new ArrayList<>(this.withdrawals.size());
            for (final Withdrawal withdrawal : this.withdrawals) {
                encodedWithdrawals.add(withdrawal.encode());
            }
            completed = partialHeader.withWithdrawalsRoot(OrderedTrie.root(encodedWithdrawals));
        }

        this.header = BlockHeader.fromPartial(completed, ommersHash, transactionsRoot);
        this.hash = header.hash();
        this.transactionReceipts = ReceiptEnricher.enrich(hash, header.number(), receipts);

        DebugLogger.logBlock(LogFormatter.formatBlockAssembled(
                header.number(),
                hash.value(),
                this.transactions.size(),
                this.ommers.size(),
                this.withdrawals != null ? this.withdrawals.size() : -1,
                (System.nanoTime() - start) / 1_000));
    }

    /**
     * Assembles a block with no transactions, no ommers and no withdrawals.
     */
    public static LocalBlock empty(final PartialHeader partialHeader) {
        return new LocalBlock(partialHeader, List.of(), List.of(), List.of(), List.of(), null);
    }

    @Override
    public Hash hash() {
        return hash;
    }

    @Override
    public BlockHeader header() {
        return header;
    }

    @Override
    public List<SignedTransaction> transactions() {
        return transactions;
    }

    @Override
    public List<Address> transactionCallers() {
        return transactionCallers;
    }

    @Override
    public List<BlockReceipt> transactionReceipts() {
        return transactionReceipts;
    }

    public List<BlockHeader> ommers() {
        return ommers;
    }

    @Override
    public List<Hash> ommerHashes() {
        return ommerHashes;
    }

    @Override
    public Optional<List<Withdrawal>> withdrawals() {
        return Optional.ofNullable(withdrawals);
    }

    @Override
    public long rlpSize() {
        return BlockEncoder.encode(this).length;
    }

    /**
     * Zips transactions, callers and receipts. Each call returns a new stream over
     * the same shared instances.
     */
    public Stream<DetailedTransaction> detailedTransactions() {
        return IntStream.range(0, transactions.size())
                .mapToObj(i -> new DetailedTransaction(
                        transactions.get(i), transactionCallers.get(i), transactionReceipts.get(i)));
    }

    public byte[] encode() {
        return BlockEncoder.encode(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LocalBlock other && hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "LocalBlock[number=" + header.number() + ", hash=" + hash.value()
                + ", transactions=" + transactions.size() + "]";
    }
}
