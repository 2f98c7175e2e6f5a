package com.tvlradar.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tvlradar.adapter.RpcEndpointRotator;
import com.tvlradar.adapter.RpcException;
import com.tvlradar.aggregation.RemoteCallExecutor;
import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.CallResult;
import com.tvlradar.domain.Chunk;
import com.tvlradar.domain.ChunkResult;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Executes every call of a chunk as {@code eth_call} of one {@link ContractFunction} at a fixed block, in a
 * single JSON-RPC batch request.
 * <p>
 * Responses are matched by id. A reverted call yields an unsuccessful {@link CallResult}; any other node error,
 * a missing response, a non-array body or a transport error fails the whole chunk with {@link RpcException}.
 */
@Slf4j
public class EvmBatchCallExecutor implements RemoteCallExecutor {

    private static final String ETH_CALL = "eth_call";

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final ContractFunction function;
    private final String blockTag;
    private final long limiterLogThresholdMs;

    public EvmBatchCallExecutor(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                                ObjectMapper objectMapper, ContractFunction function, String blockTag,
                                long limiterLogThresholdMs) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.function = function;
        this.blockTag = blockTag;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
    }

    /**
     * {@code "latest"} for a null block, otherwise the 0x-prefixed hex block number.
     */
    public static String blockTag(Long block) {
        if (block == null) {
            return "latest";
        }
        if (block < 0) {
            throw new IllegalArgumentException("block must be >= 0, got " + block);
        }
        return "0x" + Long.toHexString(block);
    }

    @Override
    public ChunkResult execute(Chunk chunk) {
        List<CallDescriptor> calls = chunk.calls();
        if (calls.isEmpty()) {
            return new ChunkResult(0, List.of());
        }
        List<RpcRequest> requests = new ArrayList<>(calls.size());
        for (CallDescriptor call : calls) {
            requests.add(new RpcRequest(ETH_CALL, List.of(callObject(call), blockTag)));
        }
        String endpoint = rotator.getNextEndpoint();
        acquirePermit(endpoint, requests.size());
        String json = rpcClient.batchCall(endpoint, requests).block();

        Map<Integer, JsonNode> byId = parseBatch(json, endpoint);
        List<CallResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            JsonNode response = byId.get(i + 1);
            if (response == null) {
                throw new RpcException("Batch " + function.signature() + " on " + endpoint
                        + ": missing response for id " + (i + 1) + " of chunk " + chunk.index());
            }
            results.add(toCallResult(calls.get(i), response));
        }
        return new ChunkResult(results.size(), results);
    }

    /**
     * One plain {@code eth_call}. Empty when the call reverted or returned no data.
     */
    public Optional<Object> callSingle(CallDescriptor call) {
        String endpoint = rotator.getNextEndpoint();
        acquirePermit(endpoint, 1);
        String json = rpcClient.call(endpoint, ETH_CALL, List.of(callObject(call), blockTag)).block();
        JsonNode root = readTree(json, endpoint);
        CallResult result = toCallResult(call, root);
        return result.success() ? Optional.ofNullable(result.output()) : Optional.empty();
    }

    public String getBlockTag() {
        return blockTag;
    }

    private Map<String, Object> callObject(CallDescriptor call) {
        Map<String, Object> callObject = new LinkedHashMap<>();
        callObject.put("to", call.target());
        callObject.put("data", function.encode(call.params()));
        return callObject;
    }

    private CallResult toCallResult(CallDescriptor call, JsonNode response) {
        JsonNode error = response.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            if (!isExecutionError(error)) {
                throw new RpcException(function.signature() + " on " + call.target() + ": RPC error " + error);
            }
            log.debug("{} on {} reverted: {}", function.signature(), call.target(), error);
            return CallResult.failure(call);
        }
        JsonNode result = response.path("result");
        if (result.isMissingNode() || result.isNull()) {
            return CallResult.failure(call);
        }
        Object decoded = function.decode(result.asText());
        return decoded == null ? CallResult.failure(call) : CallResult.success(call, decoded);
    }

    /**
     * True for errors raised by the EVM while executing the call (revert, invalid opcode, out of gas), as opposed
     * to errors of the node itself (rate limit, missing state, internal error).
     */
    static boolean isExecutionError(JsonNode error) {
        if (error.path("code").asInt() == 3) {
            return true;
        }
        String message = error.path("message").asText("").toLowerCase(Locale.ROOT);
        return message.contains("revert") || message.contains("execution")
                || message.contains("invalid opcode") || message.contains("out of gas");
    }

    private Map<Integer, JsonNode> parseBatch(String json, String endpoint) {
        JsonNode root = readTree(json, endpoint);
        if (!root.isArray()) {
            JsonNode error = root.path("error");
            throw new RpcException("Batch " + function.signature() + " on " + endpoint + ": expected JSON array"
                    + (error.isMissingNode() ? "" : ", got error " + error));
        }
        Map<Integer, JsonNode> byId = new HashMap<>();
        for (JsonNode response : root) {
            byId.put(response.path("id").asInt(), response);
        }
        return byId;
    }

    private JsonNode readTree(String json, String endpoint) {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response from " + endpoint);
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse RPC response from " + endpoint, e);
        }
    }

    private void acquirePermit(String endpoint, int requestCount) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + function.signature() + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local EVM RPC limiter delayed {} ms before {} ({} calls) on {}",
                    waitedMs, function.signature(), requestCount, endpoint);
        }
    }
}
