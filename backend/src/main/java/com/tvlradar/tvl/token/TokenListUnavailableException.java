package com.tvlradar.tvl.token;

/**
 * The supported-token list could not be fetched or parsed.
 */
public class TokenListUnavailableException extends RuntimeException {

    public TokenListUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
