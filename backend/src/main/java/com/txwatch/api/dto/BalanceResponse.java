package com.txwatch.api.dto;

import java.math.BigDecimal;

/**
 * @param balance SOL, not lamports
 */
public record BalanceResponse(String address, BigDecimal balance) {
}
