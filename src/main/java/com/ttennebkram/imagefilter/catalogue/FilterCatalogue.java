package com.ttennebkram.imagefilter.catalogue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of every filter kind, grouped by category for presentation.
 *
 * Usage:
 *   for (FilterKind kind : FilterCatalogue.getKinds()) { ... }
 *   FilterSpec spec = FilterCatalogue.defaultSpec(FilterKind.VIGNETTE);
 */
public final class FilterCatalogue {

    private static final List<FilterKind> KINDS = List.of(FilterKind.values());
    private static final Map<String, List<FilterKind>> BY_CATEGORY;

    static {
        Map<String, List<FilterKind>> grouped = new LinkedHashMap<>();
        for (FilterKind kind : KINDS) {
            grouped.computeIfAbsent(kind.getCategory(), c -> new ArrayList<>()).add(kind);
        }
        Map<String, List<FilterKind>> frozen = new LinkedHashMap<>();
        grouped.forEach((category, kinds) -> frozen.put(category, Collections.unmodifiableList(kinds)));
        BY_CATEGORY = Collections.unmodifiableMap(frozen);
    }

    private FilterCatalogue() {
    }

    /**
     * All kinds in declaration order.
     */
    public static List<FilterKind> getKinds() {
        return KINDS;
    }

    /**
     * Kinds grouped by category, categories in order of first appearance.
     */
    public static Map<String, List<FilterKind>> getCategories() {
        return BY_CATEGORY;
    }

    public static List<FilterKind> getKinds(String category) {
        return BY_CATEGORY.getOrDefault(category, Collections.emptyList());
    }

    /**
     * Look a kind up by enum name or display name, ignoring case.
     */
    public static Optional<FilterKind> findKind(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (FilterKind kind : KINDS) {
            if (kind.name().equalsIgnoreCase(trimmed) || kind.getDisplayName().equalsIgnoreCase(trimmed)) {
                return Optional.of(kind);
            }
        }
        String normalized = trimmed.toUpperCase(Locale.ROOT).replace(' ', '_');
        for (FilterKind kind : KINDS) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static FilterSpec defaultSpec(FilterKind kind) {
        return FilterSpec.of(kind);
    }

    public static int size() {
        return KINDS.size();
    }
}
