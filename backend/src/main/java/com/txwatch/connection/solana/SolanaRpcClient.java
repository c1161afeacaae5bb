package com.txwatch.connection.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC transport. Returns the raw response body; error members are interpreted by the caller.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
