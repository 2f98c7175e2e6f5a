package com.tvlradar.adapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection over the configured RPC endpoints. Each chunk takes the next endpoint, so parallel
 * chunks spread over all of them. There is no failover: a failed request fails its chunk.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);

    public RpcEndpointRotator(List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
