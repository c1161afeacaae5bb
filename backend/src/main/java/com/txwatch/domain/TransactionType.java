package com.txwatch.domain;

/**
 * Kind of tracked transaction. Critical types move user funds; polling errors on them are reported
 * with higher severity.
 */
public enum TransactionType {
    SWAP(true),
    TRANSFER(true),
    STAKE(false),
    UNSTAKE(false),
    LIQUIDITY_ADD(true),
    LIQUIDITY_REMOVE(true),
    UNKNOWN(false);

    private final boolean critical;

    TransactionType(boolean critical) {
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
