package com.txwatch.tracking;

import com.txwatch.domain.TransactionEntry;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * History ordering. Missing amount or fee sorts as zero; STATUS sorts by status name.
 */
public record SortOptions(SortBy by, boolean ascending) {

    /** Newest first. */
    public static final SortOptions DEFAULT = new SortOptions(SortBy.TIMESTAMP, false);

    public SortOptions {
        if (by == null) {
            by = SortBy.TIMESTAMP;
        }
    }

    public Comparator<TransactionEntry> comparator() {
        Comparator<TransactionEntry> c = switch (by) {
            case TIMESTAMP -> Comparator.comparing(TransactionEntry::getCreatedAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            case AMOUNT -> Comparator.comparing(e -> orZero(e.getAmount()));
            case FEE -> Comparator.comparing(e -> orZero(e.getFee()));
            case STATUS -> Comparator.comparing(e -> e.getStatus().name());
        };
        return ascending ? c : c.reversed();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
