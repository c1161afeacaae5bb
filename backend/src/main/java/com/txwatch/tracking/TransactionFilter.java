package com.txwatch.tracking;

import com.txwatch.domain.TransactionEntry;
import com.txwatch.domain.TransactionStatus;
import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * History filter; every null or empty criterion matches everything. Date bounds are inclusive, {@code address}
 * matches either side of the transfer, and an entry without an amount never satisfies an amount bound.
 */
public record TransactionFilter(
        Set<TransactionType> types,
        Set<TransactionStatus> statuses,
        Instant startDate,
        Instant endDate,
        String address,
        BigDecimal minAmount,
        BigDecimal maxAmount
) {

    public static final TransactionFilter NONE = new TransactionFilter(null, null, null, null, null, null, null);

    public TransactionFilter {
        types = types != null ? Set.copyOf(types) : Set.of();
        statuses = statuses != null ? Set.copyOf(statuses) : Set.of();
    }

    public static TransactionFilter byStatus(TransactionStatus... statuses) {
        return new TransactionFilter(null, Set.of(statuses), null, null, null, null, null);
    }

    public static TransactionFilter byType(TransactionType... types) {
        return new TransactionFilter(Set.of(types), null, null, null, null, null, null);
    }

    public boolean matches(TransactionEntry entry) {
        if (!types.isEmpty() && !types.contains(entry.getType())) {
            return false;
        }
        if (!statuses.isEmpty() && !statuses.contains(entry.getStatus())) {
            return false;
        }
        Instant createdAt = entry.getCreatedAt();
        if (startDate != null && (createdAt == null || createdAt.isBefore(startDate))) {
            return false;
        }
        if (endDate != null && (createdAt == null || createdAt.isAfter(endDate))) {
            return false;
        }
        if (address != null && !address.equals(entry.getFrom()) && !address.equals(entry.getTo())) {
            return false;
        }
        if (minAmount != null || maxAmount != null) {
            BigDecimal amount = entry.getAmount();
            if (amount == null) {
                return false;
            }
            if (minAmount != null && amount.compareTo(minAmount) < 0) {
                return false;
            }
            if (maxAmount != null && amount.compareTo(maxAmount) > 0) {
                return false;
            }
        }
        return true;
    }
}
