package com.ttennebkram.imagefilter.mask;

import com.ttennebkram.imagefilter.catalogue.FilterChain;

import java.util.Objects;

/**
 * A filter chain scoped to the region of a mask.
 */
public final class MaskedFilter {

    private final Mask mask;
    private final FilterChain chain;

    public MaskedFilter(Mask mask, FilterChain chain) {
        this.mask = Objects.requireNonNull(mask, "mask");
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    public Mask getMask() {
        return mask;
    }

    public FilterChain getChain() {
        return chain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaskedFilter other)) return false;
        return mask.equals(other.mask) && chain.equals(other.chain);
    }

    @Override
    public int hashCode() {
        return 31 * mask.hashCode() + chain.hashCode();
    }

    @Override
    public String toString() {
        return "MaskedFilter[" + mask + ", " + chain + "]";
    }
}
