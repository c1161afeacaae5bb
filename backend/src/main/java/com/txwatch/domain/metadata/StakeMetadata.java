package com.txwatch.domain.metadata;

import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;

public record StakeMetadata(
        String poolId,
        BigDecimal amount
) implements TransactionMetadata {

    @Override
    public boolean supports(TransactionType type) {
        return type == TransactionType.STAKE || type == TransactionType.UNSTAKE;
    }
}
