package com.txwatch.tracking.store;

import java.util.Optional;

/**
 * Durable key/value storage for whole-ledger snapshots. Values are opaque bytes; a write replaces the previous value.
 */
public interface SnapshotStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);
}
