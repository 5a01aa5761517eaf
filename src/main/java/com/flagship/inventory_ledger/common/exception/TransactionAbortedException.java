package com.flagship.inventory_ledger.common.exception;

/**
 * The atomic scope was rolled back because of a lock wait timeout, a deadlock,
 * a serialization or version conflict, or the transaction timeout.
 * Nothing was written; the whole operation may be retried.
 */
public class TransactionAbortedException extends InventoryException {

    public TransactionAbortedException(String operation, Throwable cause) {
        super("Transaction aborted during " + operation + ", safe to retry", cause);
    }

    @Override
    public String getErrorCode() {
        return "Transaction Aborted";
    }
}
