package com.ttennebkram.imagefilter.persistence;

import com.ttennebkram.imagefilter.catalogue.FilterChain;

import java.util.Objects;

/**
 * A named, reusable filter chain.
 */
public final class TemplateFilter {

    private final String name;
    private final FilterChain chain;

    /**
     * @param name display name; everything but letters and whitespace is dropped and the result trimmed
     * @throws IllegalArgumentException if nothing of the name survives
     */
    public TemplateFilter(String name, FilterChain chain) {
        this.name = sanitizeName(name);
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Template name must contain letters: '" + name + "'");
        }
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    public static String sanitizeName(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        name.codePoints()
                .filter(cp -> Character.isLetter(cp) || Character.isWhitespace(cp))
                .forEach(sb::appendCodePoint);
        return sb.toString().trim();
    }

    public String getName() {
        return name;
    }

    public FilterChain getChain() {
        return chain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateFilter other)) return false;
        return name.equals(other.name) && chain.equals(other.chain);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + chain.hashCode();
    }

    @Override
    public String toString() {
        return "TemplateFilter[" + name + ", " + chain.size() + " filter(s)]";
    }
}
