package com.txwatch.domain.metadata;

import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;

/**
 * @param token mint address or symbol; null for native SOL
 */
public record TransferMetadata(
        String recipient,
        String token,
        BigDecimal amount
) implements TransactionMetadata {

    @Override
    public boolean supports(TransactionType type) {
        return type == TransactionType.TRANSFER;
    }
}
