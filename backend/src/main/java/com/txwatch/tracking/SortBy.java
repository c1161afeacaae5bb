package com.txwatch.tracking;

public enum SortBy {
    TIMESTAMP,
    AMOUNT,
    FEE,
    STATUS
}
