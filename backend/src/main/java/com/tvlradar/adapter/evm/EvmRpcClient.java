package com.tvlradar.adapter.evm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC transport. Returns raw JSON bodies; envelope errors are interpreted by the caller.
 */
public interface EvmRpcClient {

    /**
     * Single JSON-RPC request with id 1.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      positional params
     * @return response body (JSON object)
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * JSON-RPC batch in one HTTP request; request {@code i} is sent with id {@code i + 1}.
     *
     * @return response body (JSON array, in any order)
     */
    Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests);
}
