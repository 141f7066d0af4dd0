package com.ttennebkram.imagefilter.persistence;

import com.ttennebkram.imagefilter.catalogue.FilterKind;

import java.io.IOException;
import java.util.List;

/**
 * User-level filter preferences: favourite kinds and saved template chains.
 * Every mutation is persisted before the call returns.
 */
public interface FavoriteFiltersInteractor {

    List<FilterKind> getFavoriteFilters();

    boolean isFavorite(FilterKind kind);

    void addFavoriteFilter(FilterKind kind) throws IOException;

    void removeFavoriteFilter(FilterKind kind) throws IOException;

    /**
     * @return true if the kind is a favourite after the call
     */
    boolean toggleFavoriteFilter(FilterKind kind) throws IOException;

    /**
     * Replaces the favourite order. Kinds not already favourites are ignored.
     */
    void reorderFavoriteFilters(List<FilterKind> order) throws IOException;

    List<TemplateFilter> getTemplateFilters();

    /**
     * Adds a template, replacing any existing template with the same name.
     */
    void addTemplateFilter(TemplateFilter template) throws IOException;

    boolean removeTemplateFilter(String name) throws IOException;

    String convertTemplateFilterToString(TemplateFilter template);

    /**
     * Parses a string produced by {@link #convertTemplateFilterToString} and stores it.
     *
     * @throws IOException if the text is not a valid template
     */
    TemplateFilter addTemplateFilterFromString(String text) throws IOException;

    boolean isValidTemplateFilter(String text);
}
