package com.ttennebkram.imagefilter.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ttennebkram.imagefilter.catalogue.FilterCatalogue;
import com.ttennebkram.imagefilter.catalogue.FilterKind;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps favourites and templates in a single JSON file:
 * <pre>
 * {"version": 1, "favorites": ["EXPOSURE"], "templates": [{"name": "Warm", "filters": [...]}]}
 * </pre>
 * A missing file is an empty store. Unknown kinds, non-string favourite entries
 * and broken templates in an existing file are skipped with a warning; a file
 * whose sections have the wrong shape is rejected with an {@link IOException}.
 * Changes are kept in memory only after they have been written.
 */
public class JsonFavoriteFiltersStore implements FavoriteFiltersInteractor {

    private static final Logger LOGGER = Logger.getLogger(JsonFavoriteFiltersStore.class.getName());
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path file;
    private final Set<FilterKind> favorites = new LinkedHashSet<>();
    private final Map<String, TemplateFilter> templates = new LinkedHashMap<>();

    public JsonFavoriteFiltersStore(Path file) throws IOException {
        this.file = file;
        if (Files.exists(file)) {
            read();
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized List<FilterKind> getFavoriteFilters() {
        return List.copyOf(favorites);
    }

    @Override
    public synchronized boolean isFavorite(FilterKind kind) {
        return favorites.contains(kind);
    }

    @Override
    public synchronized void addFavoriteFilter(FilterKind kind) throws IOException {
        Set<FilterKind> updated = new LinkedHashSet<>(favorites);
        if (updated.add(kind)) {
            commit(updated, templates);
        }
    }

    @Override
    public synchronized void removeFavoriteFilter(FilterKind kind) throws IOException {
        Set<FilterKind> updated = new LinkedHashSet<>(favorites);
        if (updated.remove(kind)) {
            commit(updated, templates);
        }
    }

    @Override
    public synchronized boolean toggleFavoriteFilter(FilterKind kind) throws IOException {
        Set<FilterKind> updated = new LinkedHashSet<>(favorites);
        boolean nowFavorite = !updated.remove(kind);
        if (nowFavorite) {
            updated.add(kind);
        }
        commit(updated, templates);
        return nowFavorite;
    }

    @Override
    public synchronized void reorderFavoriteFilters(List<FilterKind> order) throws IOException {
        Set<FilterKind> reordered = new LinkedHashSet<>();
        for (FilterKind kind : order) {
            if (favorites.contains(kind)) {
                reordered.add(kind);
            }
        }
        // favourites missing from the new order keep their relative position at the end
        reordered.addAll(favorites);
        commit(reordered, templates);
    }

    @Override
    public synchronized List<TemplateFilter> getTemplateFilters() {
        return List.copyOf(templates.values());
    }

    public synchronized Optional<TemplateFilter> findTemplateFilter(String name) {
        return Optional.ofNullable(templates.get(TemplateFilter.sanitizeName(name)));
    }

    @Override
    public synchronized void addTemplateFilter(TemplateFilter template) throws IOException {
        Map<String, TemplateFilter> updated = new LinkedHashMap<>(templates);
        updated.put(template.getName(), template);
        commit(favorites, updated);
    }

    @Override
    public synchronized boolean removeTemplateFilter(String name) throws IOException {
        Map<String, TemplateFilter> updated = new LinkedHashMap<>(templates);
        if (updated.remove(TemplateFilter.sanitizeName(name)) == null) {
            return false;
        }
        commit(favorites, updated);
        return true;
    }

    @Override
    public String convertTemplateFilterToString(TemplateFilter template) {
        return FilterChainSerializer.templateToString(template);
    }

    @Override
    public TemplateFilter addTemplateFilterFromString(String text) throws IOException {
        TemplateFilter template = FilterChainSerializer.templateFromString(text);
        addTemplateFilter(template);
        return template;
    }

    @Override
    public boolean isValidTemplateFilter(String text) {
        try {
            FilterChainSerializer.templateFromString(text);
            return true;
        } catch (IOException e) {
            LOGGER.fine("Rejected template text: " + e.getMessage());
            return false;
        }
    }

    private void read() throws IOException {
        JsonObject root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = FilterChainSerializer.parseObject(reader, "favorites");
        }
        try {
            readEntries(root);
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            throw new IOException("Invalid favorites file: " + file + ": " + e.getMessage(), e);
        }
    }

    private void readEntries(JsonObject root) {
        if (root.has("favorites")) {
            for (JsonElement element : root.getAsJsonArray("favorites")) {
                if (!element.isJsonPrimitive()) {
                    LOGGER.warning("Skipping favourite entry " + element + " in " + file + ", expected a kind name");
                    continue;
                }
                String name = element.getAsString();
                Optional<FilterKind> kind = FilterCatalogue.findKind(name);
                if (kind.isPresent()) {
                    favorites.add(kind.get());
                } else {
                    LOGGER.warning("Skipping unknown favourite filter '" + name + "' in " + file);
                }
            }
        }
        if (root.has("templates")) {
            for (JsonElement element : root.getAsJsonArray("templates")) {
                if (!element.isJsonObject()) {
                    continue;
                }
                try {
                    TemplateFilter template = FilterChainSerializer.templateFromTree(element.getAsJsonObject());
                    templates.put(template.getName(), template);
                } catch (IOException e) {
                    LOGGER.log(Level.WARNING, "Skipping template in " + file + ": " + e.getMessage());
                }
            }
        }
    }

    /**
     * Write the given state and adopt it only once the file is in place.
     */
    private void commit(Set<FilterKind> newFavorites, Map<String, TemplateFilter> newTemplates) throws IOException {
        write(newFavorites, newTemplates);
        if (newFavorites != favorites) {
            favorites.clear();
            favorites.addAll(newFavorites);
        }
        if (newTemplates != templates) {
            templates.clear();
            templates.putAll(newTemplates);
        }
    }

    private void write(Set<FilterKind> favorites, Map<String, TemplateFilter> templates) throws IOException {
        JsonObject root = new JsonObject();
        root.addProperty("version", FilterChainSerializer.FORMAT_VERSION);
        JsonArray favoritesJson = new JsonArray();
        for (FilterKind kind : favorites) {
            favoritesJson.add(kind.name());
        }
        root.add("favorites", favoritesJson);
        JsonArray templatesJson = new JsonArray();
        for (TemplateFilter template : templates.values()) {
            templatesJson.add(FilterChainSerializer.templateToTree(template));
        }
        root.add("templates", templatesJson);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                GSON.toJson(root, writer);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOGGER.fine("Saved " + favorites.size() + " favourite(s) and " + templates.size() + " template(s) to " + file);
    }

    @Override
    public String toString() {
        return "JsonFavoriteFiltersStore[" + file + "]";
    }
}
