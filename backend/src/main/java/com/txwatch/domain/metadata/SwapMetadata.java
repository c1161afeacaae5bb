package com.txwatch.domain.metadata;

import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;

public record SwapMetadata(
        String inputToken,
        String outputToken,
        BigDecimal inputAmount,
        BigDecimal expectedOutputAmount
) implements TransactionMetadata {

    @Override
    public boolean supports(TransactionType type) {
        return type == TransactionType.SWAP;
    }
}
