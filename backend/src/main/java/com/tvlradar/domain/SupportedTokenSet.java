package com.tvlradar.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable allow-list of token addresses, normalized to lower case. Membership is case-insensitive.
 */
public final class SupportedTokenSet {

    private static final SupportedTokenSet EMPTY = new SupportedTokenSet(Set.of());

    private final Set<String> addresses;

    private SupportedTokenSet(Set<String> addresses) {
        this.addresses = addresses;
    }

    public static SupportedTokenSet of(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return EMPTY;
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String address : addresses) {
            if (address == null || address.isBlank()) {
                continue;
            }
            normalized.add(address.strip().toLowerCase(Locale.ROOT));
        }
        return new SupportedTokenSet(Set.copyOf(normalized));
    }

    public static SupportedTokenSet empty() {
        return EMPTY;
    }

    public boolean contains(String address) {
        return address != null && addresses.contains(address.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return addresses.size();
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }
}
