package com.tvlradar.domain;

/**
 * Decoded outcome of one call inside a batch. {@code success == false} means the call was executed
 * but reverted (or returned an error); {@code output} is then null.
 */
public record CallResult(CallDescriptor call, boolean success, Object output) {

    public static CallResult success(CallDescriptor call, Object output) {
        return new CallResult(call, true, output);
    }

    public static CallResult failure(CallDescriptor call) {
        return new CallResult(call, false, null);
    }
}
