package com.txwatch.connection;

import java.util.Locale;

/**
 * Durability level requested when querying ledger state.
 */
public enum Commitment {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    /** Value sent in the JSON-RPC {@code commitment} field. */
    public String rpcValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
