package com.tvlradar.tvl.discovery;

import com.tvlradar.adapter.evm.ContractFunction;
import com.tvlradar.adapter.evm.EvmBatchCallExecutor;
import com.tvlradar.adapter.evm.EvmCallExecutorFactory;
import com.tvlradar.aggregation.BatchCallAggregator;
import com.tvlradar.aggregation.CombinedResult;
import com.tvlradar.config.AsyncConfig;
import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.CallResult;
import com.tvlradar.domain.PairRecord;
import com.tvlradar.domain.SupportedTokenSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Enumerates the pairs of a factory and keeps the ones holding a supported token:
 * allPairsLength() once, allPairs(i) for every index, then token0() and token1() of every pair in parallel.
 */
@Service
@Slf4j
public class PairDiscoveryService {

    private final BatchCallAggregator aggregator;
    private final EvmCallExecutorFactory executorFactory;
    private final Executor discoveryExecutor;

    public PairDiscoveryService(
            BatchCallAggregator aggregator,
            EvmCallExecutorFactory executorFactory,
            @Qualifier(AsyncConfig.DISCOVERY_EXECUTOR) Executor discoveryExecutor
    ) {
        this.aggregator = aggregator;
        this.executorFactory = executorFactory;
        this.discoveryExecutor = discoveryExecutor;
    }

    public PairDiscovery discover(String factoryAddress, SupportedTokenSet supportedTokens, Long block) {
        String factory = factoryAddress.toLowerCase(Locale.ROOT);
        int pairCount = readPairCount(factory, block);
        long callCount = 1;

        CombinedResult pairResults = aggregator.multiCall("allPairs", pairIndexCalls(factory, pairCount),
                executorFactory.forFunction(ContractFunction.ALL_PAIRS, block));
        callCount += pairResults.callCount();
        List<String> pairAddresses = pairAddresses(pairResults.results());

        List<CallDescriptor> pairCalls = pairAddresses.stream()
                .map(CallDescriptor::of)
                .toList();
        CompletableFuture<CombinedResult> token0 = CompletableFuture.supplyAsync(() -> aggregator.multiCall(
                "token0", pairCalls, executorFactory.forFunction(ContractFunction.TOKEN0, block)), discoveryExecutor);
        CompletableFuture<CombinedResult> token1 = CompletableFuture.supplyAsync(() -> aggregator.multiCall(
                "token1", pairCalls, executorFactory.forFunction(ContractFunction.TOKEN1, block)), discoveryExecutor);
        CombinedResult token0Results = join(token0, token1);
        CombinedResult token1Results = join(token1, token0);
        callCount += token0Results.callCount() + token1Results.callCount();

        List<PairRecord> retained = retainSupported(pairAddresses, token0Results.results(), token1Results.results(),
                supportedTokens);
        log.info("Factory {}: {} pairs, {} with a supported token", factory, pairCount, retained.size());
        return new PairDiscovery(pairCount, retained, callCount);
    }

    private int readPairCount(String factory, Long block) {
        EvmBatchCallExecutor executor = executorFactory.forFunction(ContractFunction.ALL_PAIRS_LENGTH, block);
        Optional<Object> length = executor.callSingle(CallDescriptor.of(factory));
        if (length.isEmpty()) {
            throw new FatalDiscoveryException("allPairsLength() failed for factory " + factory
                    + " at block " + executor.getBlockTag());
        }
        BigInteger count = (BigInteger) length.get();
        if (count.bitLength() > 31) {
            throw new FatalDiscoveryException("allPairsLength() returned an unusable value " + count);
        }
        return count.intValue();
    }

    static List<CallDescriptor> pairIndexCalls(String factory, int pairCount) {
        List<CallDescriptor> calls = new ArrayList<>(pairCount);
        for (int i = 0; i < pairCount; i++) {
            calls.add(CallDescriptor.of(factory, BigInteger.valueOf(i)));
        }
        return calls;
    }

    static List<String> pairAddresses(List<CallResult> results) {
        List<String> addresses = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            CallResult result = results.get(i);
            if (!result.success() || result.output() == null) {
                throw new FatalDiscoveryException("allPairs(" + i + ") returned no pair address");
            }
            addresses.add(result.output().toString().toLowerCase(Locale.ROOT));
        }
        return addresses;
    }

    /**
     * Pairs in index order with the supported side(s) filled in; pairs with no supported token are dropped.
     * A token call that reverted counts as unsupported for that side.
     */
    public static List<PairRecord> retainSupported(List<String> pairAddresses, List<CallResult> token0Results,
                                                   List<CallResult> token1Results, SupportedTokenSet supportedTokens) {
        if (token0Results.size() != pairAddresses.size() || token1Results.size() != pairAddresses.size()) {
            throw new IllegalArgumentException("token results do not line up with " + pairAddresses.size() + " pairs");
        }
        List<PairRecord> retained = new ArrayList<>();
        for (int i = 0; i < pairAddresses.size(); i++) {
            PairRecord pair = new PairRecord(pairAddresses.get(i));
            supportedToken(token0Results.get(i), supportedTokens).ifPresent(pair::setToken0Address);
            supportedToken(token1Results.get(i), supportedTokens).ifPresent(pair::setToken1Address);
            if (pair.hasSupportedToken()) {
                retained.add(pair);
            }
        }
        return retained;
    }

    /**
     * One balanceOf(pair) call per retained token: target is the token, the queried account is the pair.
     */
    public static List<CallDescriptor> balanceCalls(List<PairRecord> pairs) {
        List<CallDescriptor> calls = new ArrayList<>();
        for (PairRecord pair : pairs) {
            if (pair.getToken0Address() != null) {
                calls.add(CallDescriptor.of(pair.getToken0Address(), pair.getPairAddress()));
            }
            if (pair.getToken1Address() != null) {
                calls.add(CallDescriptor.of(pair.getToken1Address(), pair.getPairAddress()));
            }
        }
        return calls;
    }

    private static Optional<String> supportedToken(CallResult result, SupportedTokenSet supportedTokens) {
        if (!result.success() || result.output() == null) {
            return Optional.empty();
        }
        String token = result.output().toString().toLowerCase(Locale.ROOT);
        return supportedTokens.contains(token) ? Optional.of(token) : Optional.empty();
    }

    private static <T> T join(CompletableFuture<T> future, CompletableFuture<?> sibling) {
        try {
            return future.join();
        } catch (CompletionException e) {
            sibling.cancel(true);
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
