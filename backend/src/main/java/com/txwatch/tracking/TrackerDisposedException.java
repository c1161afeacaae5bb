package com.txwatch.tracking;

/**
 * Thrown when a transaction is submitted to a tracker that has been shut down.
 */
public class TrackerDisposedException extends IllegalStateException {

    public TrackerDisposedException() {
        super("Transaction tracker is disposed");
    }
}
