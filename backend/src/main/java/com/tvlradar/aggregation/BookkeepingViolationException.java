package com.tvlradar.aggregation;

/**
 * Call bookkeeping does not add up (planned chunk sizes or executed call counts differ from the input size).
 * Indicates a bug, never a remote condition; not meant to be caught.
 */
public class BookkeepingViolationException extends IllegalStateException {

    public BookkeepingViolationException(String message) {
        super(message);
    }
}
