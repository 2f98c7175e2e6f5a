package com.tvlradar.tvl.token;

import java.util.List;

/**
 * Supplies the token addresses whose balances count toward TVL.
 */
public interface SupportedTokenSource {

    List<String> supportedTokens();
}
