package com.vaultledger.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Endpoint choice, rate limiting and retries belong to the caller.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getTransactionReceipt"
     * @param params      positional params
     * @return raw response body (JSON); errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
