package com.tvlradar.domain;

import lombok.EqualsAndHashCode;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Token address (lower case) to raw balance in the token's native integer unit.
 * Additive: {@link #add} and {@link #merge} are commutative and associative, and keys are kept sorted so two
 * mappings built in a different order compare equal.
 * <p>
 * Not thread-safe; one owner accumulates into it.
 * <p>
 * The "no balances found" sentinel maps the zero address to the plain {@code Integer} 0 rather than a
 * {@link BigInteger}. Downstream consumers rely on that shape, so {@link #asMap()} keeps it.
 */
@EqualsAndHashCode
public final class BalanceMapping {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Map<String, BigInteger> balances = new TreeMap<>();
    private final boolean noBalancesFound;

    public BalanceMapping() {
        this(false);
    }

    private BalanceMapping(boolean noBalancesFound) {
        this.noBalancesFound = noBalancesFound;
    }

    /**
     * The sentinel returned when nothing accumulated: {@code {0x000..000: 0}}.
     */
    public static BalanceMapping noBalancesFound() {
        return new BalanceMapping(true);
    }

    public static BalanceMapping of(Map<String, BigInteger> values) {
        BalanceMapping mapping = new BalanceMapping();
        values.forEach(mapping::add);
        return mapping;
    }

    public void add(String token, BigInteger amount) {
        if (noBalancesFound) {
            throw new IllegalStateException("The no-balances sentinel is read-only");
        }
        if (token == null || amount == null) {
            return;
        }
        balances.merge(token.toLowerCase(Locale.ROOT), amount, BigInteger::add);
    }

    public void merge(BalanceMapping other) {
        if (other == null || other.noBalancesFound) {
            return;
        }
        other.balances.forEach(this::add);
    }

    public BigInteger get(String token) {
        if (token == null) {
            return null;
        }
        return balances.get(token.toLowerCase(Locale.ROOT));
    }

    public Set<String> tokens() {
        return Collections.unmodifiableSet(balances.keySet());
    }

    public boolean isEmpty() {
        return balances.isEmpty();
    }

    public boolean isNoBalancesFound() {
        return noBalancesFound;
    }

    public int size() {
        return noBalancesFound ? 1 : balances.size();
    }

    /**
     * Caller-visible view. Real balances are {@link BigInteger}; the sentinel value is {@code Integer} 0.
     */
    public Map<String, Number> asMap() {
        if (noBalancesFound) {
            return Map.of(ZERO_ADDRESS, 0);
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }

    @Override
    public String toString() {
        return "BalanceMapping" + asMap();
    }
}
