package com.txwatch.connection.model;

/**
 * On-chain account as returned by getAccountInfo / getProgramAccounts (base64 data decoded).
 */
public record AccountInfo(
        String address,
        long lamports,
        String owner,
        boolean executable,
        long rentEpoch,
        byte[] data
) {
}
