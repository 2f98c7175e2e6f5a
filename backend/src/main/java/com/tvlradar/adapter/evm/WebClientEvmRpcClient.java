package com.tvlradar.adapter.evm;

import com.tvlradar.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link EvmRpcClient} over Spring WebClient. HTTP error statuses and connection failures surface as {@link RpcException}.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private static final String JSON_RPC_VERSION = "2.0";

    private final WebClient webClient;

    public WebClientEvmRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        return post(endpointUrl, envelope(1, method, params));
    }

    @Override
    public Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests) {
        List<Map<String, Object>> batch = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            RpcRequest request = requests.get(i);
            batch.add(envelope(i + 1, request.method(), request.params()));
        }
        return post(endpointUrl, batch);
    }

    private Mono<String> post(String endpointUrl, Object body) {
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException("HTTP " + e.getStatusCode().value() + " from " + endpointUrl + ": " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new RpcException("Request to " + endpointUrl + " failed: " + e.getMessage(), e));
    }

    private static Map<String, Object> envelope(int id, String method, Object params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSON_RPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params != null ? params : List.of());
        return request;
    }
}
