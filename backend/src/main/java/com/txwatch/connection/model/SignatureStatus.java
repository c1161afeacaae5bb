package com.txwatch.connection.model;

/**
 * Node view of a submitted signature.
 *
 * @param confirmations blocks built on top of the transaction's slot; null once the slot is rooted
 * @param err           node error, as sent when textual and as compact JSON otherwise; null on success
 */
public record SignatureStatus(
        long slot,
        Integer confirmations,
        String err,
        String confirmationStatus
) {

    public boolean failed() {
        return err != null;
    }
}
