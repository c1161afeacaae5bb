package com.txwatch.tracking;

import com.txwatch.domain.TransactionEntry;

/**
 * Receives a copy of an entry each time it is added or changes status.
 */
@FunctionalInterface
public interface TransactionListener {

    void onTransactionUpdate(TransactionEntry entry);
}
