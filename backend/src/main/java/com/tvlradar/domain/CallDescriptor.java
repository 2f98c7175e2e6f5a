package com.tvlradar.domain;

import java.util.List;
import java.util.Objects;

/**
 * One logical on-chain read: call a function on {@code target} with {@code params}.
 * Position inside a descriptor list is meaningful; results are returned in the same order.
 */
public record CallDescriptor(String target, List<Object> params) {

    public CallDescriptor {
        Objects.requireNonNull(target, "target");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static CallDescriptor of(String target, Object... params) {
        return new CallDescriptor(target, List.of(params));
    }
}
