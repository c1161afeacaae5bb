package com.txwatch.api.dto;

import com.txwatch.domain.TransactionType;
import com.txwatch.domain.metadata.TransactionMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/transactions request body. {@code metadata} is optional and carries a {@code kind} discriminator
 * (swap, transfer, stake, liquidity, generic).
 */
public record AddTransactionRequest(
        @NotBlank(message = "INVALID_SIGNATURE")
        String signature,

        @NotNull(message = "INVALID_TYPE")
        TransactionType type,

        @NotBlank(message = "INVALID_ADDRESS")
        String from,

        TransactionMetadata metadata
) {
}
