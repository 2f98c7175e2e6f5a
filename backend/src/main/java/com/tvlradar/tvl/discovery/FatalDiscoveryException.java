package com.tvlradar.tvl.discovery;

/**
 * The factory could not be enumerated (unreadable pair count or pair slot). Not retried.
 */
public class FatalDiscoveryException extends RuntimeException {

    public FatalDiscoveryException(String message) {
        super(message);
    }
}
