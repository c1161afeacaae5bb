package com.txwatch.api.dto;

public record ClearHistoryResponse(int removed) {
}
