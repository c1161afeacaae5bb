package com.txwatch.domain.metadata;

import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;

public record LiquidityMetadata(
        String poolId,
        String tokenA,
        String tokenB,
        BigDecimal amountA,
        BigDecimal amountB
) implements TransactionMetadata {

    @Override
    public boolean supports(TransactionType type) {
        return type == TransactionType.LIQUIDITY_ADD || type == TransactionType.LIQUIDITY_REMOVE;
    }
}
