package com.tvlradar.adapter.evm;

/**
 * One JSON-RPC request inside a batch; the batch position determines its id (1-based).
 */
public record RpcRequest(String method, Object params) {}
