package com.tvlradar.tvl;

import com.tvlradar.adapter.evm.ContractFunction;
import com.tvlradar.adapter.evm.EvmCallExecutorFactory;
import com.tvlradar.aggregation.BatchCallAggregator;
import com.tvlradar.aggregation.CombinedResult;
import com.tvlradar.domain.BalanceMapping;
import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.SupportedTokenSet;
import com.tvlradar.tvl.config.TvlProperties;
import com.tvlradar.tvl.discovery.PairDiscovery;
import com.tvlradar.tvl.discovery.PairDiscoveryService;
import com.tvlradar.tvl.token.SupportedTokenSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Total value locked in the configured factory's pairs: supported-token balances held by every pair, summed per
 * token. Any failure aborts the run; there is no partial result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TvlService {

    private final SupportedTokenSource supportedTokenSource;
    private final PairDiscoveryService pairDiscoveryService;
    private final BatchCallAggregator aggregator;
    private final EvmCallExecutorFactory executorFactory;
    private final TvlProperties tvlProperties;

    /**
     * @param timestamp informational only; the block decides the chain state read
     * @param block     block number, or null for the latest block
     */
    public BalanceMapping computeTvl(Long timestamp, Long block) {
        return run(timestamp, block).balances();
    }

    public TvlReport run(Long timestamp, Long block) {
        String factory = tvlProperties.getFactoryAddress();
        log.info("TVL run started: factory={}, block={}, timestamp={}", factory, block == null ? "latest" : block,
                timestamp);
        long started = System.currentTimeMillis();

        SupportedTokenSet supported = SupportedTokenSet.of(supportedTokenSource.supportedTokens());
        if (supported.isEmpty()) {
            log.warn("Supported-token set is empty; no balances will be counted");
        }
        PairDiscovery discovery = pairDiscoveryService.discover(factory, supported, block);

        List<CallDescriptor> balanceCalls = PairDiscoveryService.balanceCalls(discovery.pairs());
        CombinedResult balances = aggregator.sumBalances("balanceOf", balanceCalls,
                executorFactory.forFunction(ContractFunction.BALANCE_OF, block));

        long callCount = discovery.callCount() + balances.callCount();
        log.info("TVL run finished in {} ms: {} pairs, {} retained, {} balance calls, {} tokens, {} calls total",
                System.currentTimeMillis() - started, discovery.pairCount(), discovery.pairs().size(),
                balanceCalls.size(), balances.balances().size(), callCount);
        return new TvlReport(block, timestamp, discovery.pairCount(), discovery.pairs().size(), callCount,
                balances.balances());
    }
}
