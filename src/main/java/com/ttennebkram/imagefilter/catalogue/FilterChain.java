package com.ttennebkram.imagefilter.catalogue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence of filters. Order is significant; the empty
 * chain is the identity transformation.
 */
public final class FilterChain implements Iterable<FilterSpec> {

    private static final FilterChain EMPTY = new FilterChain(Collections.emptyList());

    private final List<FilterSpec> specs;

    private FilterChain(List<FilterSpec> specs) {
        this.specs = specs;
    }

    public static FilterChain empty() {
        return EMPTY;
    }

    public static FilterChain of(FilterSpec... specs) {
        return of(Arrays.asList(specs));
    }

    public static FilterChain of(List<FilterSpec> specs) {
        if (specs.isEmpty()) {
            return EMPTY;
        }
        List<FilterSpec> copy = new ArrayList<>(specs.size());
        for (FilterSpec spec : specs) {
            copy.add(Objects.requireNonNull(spec, "chain must not contain null specs"));
        }
        return new FilterChain(Collections.unmodifiableList(copy));
    }

    /**
     * New chain with the given spec appended.
     */
    public FilterChain then(FilterSpec spec) {
        List<FilterSpec> copy = new ArrayList<>(specs);
        copy.add(Objects.requireNonNull(spec, "spec"));
        return new FilterChain(Collections.unmodifiableList(copy));
    }

    public FilterChain then(FilterKind kind, double... values) {
        return then(FilterSpec.of(kind, values));
    }

    public List<FilterSpec> specs() {
        return specs;
    }

    public FilterSpec get(int index) {
        return specs.get(index);
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    @Override
    public Iterator<FilterSpec> iterator() {
        return specs.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterChain other)) return false;
        return specs.equals(other.specs);
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return "FilterChain" + specs;
    }
}
