// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.error;

/**
 * Thrown when the inputs handed to block assembly do not line up, for example
 * when there is not exactly one caller and one receipt per transaction.
 */
public final class BlockAssemblyException extends SmeltException {

    private final int transactionCount;
    private final int callerCount;
    private final int receiptCount;

    public BlockAssemblyException(final int transactionCount, final int callerCount, final int receiptCount) {
        super("Block inputs are misaligned: " + transactionCount + " transactions, "
                + callerCount + " callers, " + receiptCount + " receipts");
        this.transactionCount = transactionCount;
        this.callerCount = callerCount;
        this.receiptCount = receiptCount;
    }

    public int transactionCount() {
        return transactionCount;
    }

    public int callerCount() {
        return callerCount;
    }

    public int receiptCount() {
        return receiptCount;
    }
}
