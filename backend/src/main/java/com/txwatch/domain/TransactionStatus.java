package com.txwatch.domain;

/**
 * Confirmation lifecycle: PENDING moves exactly once to one of the terminal values.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
