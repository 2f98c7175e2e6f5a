package com.tvlradar.aggregation;

import lombok.extern.slf4j.Slf4j;

/**
 * Default progress observer: debug line per chunk, info line when a multi-chunk dispatch finishes.
 */
@Slf4j
public class LoggingProgressObserver implements ProgressObserver {

    @Override
    public void onChunkCompleted(String operation, int completed, int total) {
        if (log.isDebugEnabled()) {
            log.debug("{}: {}/{} chunks ({}%)", operation, completed, total, completed * 100 / Math.max(1, total));
        }
        if (completed == total && total > 1) {
            log.info("{}: all {} chunks completed", operation, total);
        }
    }
}
