package com.txwatch.api.dto;

public record RetryPendingResponse(int rearmed, long pending) {
}
