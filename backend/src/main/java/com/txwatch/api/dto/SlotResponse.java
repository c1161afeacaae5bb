package com.txwatch.api.dto;

public record SlotResponse(long slot) {
}
