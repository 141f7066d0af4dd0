package com.ttennebkram.imagefilter.persistence;

import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFavoriteFiltersStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsAnEmptyStore() throws Exception {
        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(tempDir.resolve("none.json"));

        assertThat(store.getFavoriteFilters()).isEmpty();
        assertThat(store.getTemplateFilters()).isEmpty();
        assertThat(Files.exists(store.getFile())).isFalse();
    }

    @Test
    void favouritesPersistInOrder() throws Exception {
        Path file = tempDir.resolve("prefs/favorites.json");
        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(file);

        store.addFavoriteFilter(FilterKind.SEPIA);
        store.addFavoriteFilter(FilterKind.HUE);
        assertThat(store.toggleFavoriteFilter(FilterKind.BOKEH)).isTrue();
        assertThat(store.toggleFavoriteFilter(FilterKind.HUE)).isFalse();
        store.reorderFavoriteFilters(List.of(FilterKind.BOKEH, FilterKind.INVERT));

        JsonFavoriteFiltersStore reloaded = new JsonFavoriteFiltersStore(file);
        assertThat(reloaded.getFavoriteFilters()).containsExactly(FilterKind.BOKEH, FilterKind.SEPIA);
        assertThat(reloaded.isFavorite(FilterKind.SEPIA)).isTrue();
        assertThat(reloaded.isFavorite(FilterKind.HUE)).isFalse();

        reloaded.removeFavoriteFilter(FilterKind.SEPIA);
        assertThat(new JsonFavoriteFiltersStore(file).getFavoriteFilters()).containsExactly(FilterKind.BOKEH);
    }

    @Test
    void templatesAreKeyedBySanitisedName() throws Exception {
        Path file = tempDir.resolve("favorites.json");
        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(file);
        FilterChain first = FilterChain.empty().then(FilterKind.GRAYSCALE);
        FilterChain second = FilterChain.empty().then(FilterKind.SEPIA, 0.7);

        store.addTemplateFilter(new TemplateFilter("Old Photo #1", first));
        store.addTemplateFilter(new TemplateFilter("  Old Photo ", second));

        JsonFavoriteFiltersStore reloaded = new JsonFavoriteFiltersStore(file);
        assertThat(reloaded.getTemplateFilters()).hasSize(1);
        assertThat(reloaded.findTemplateFilter("Old Photo")).hasValueSatisfying(t ->
                assertThat(t.getChain()).isEqualTo(second));
        assertThat(reloaded.removeTemplateFilter("Old Photo 2")).isTrue();
        assertThat(reloaded.removeTemplateFilter("Old Photo")).isFalse();
    }

    @Test
    void importsTemplatesSharedAsText() throws Exception {
        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(tempDir.resolve("favorites.json"));
        TemplateFilter shared = new TemplateFilter("Crisp",
                FilterChain.empty().then(FilterKind.SHARPEN, 1.5).then(FilterKind.CONTRAST, 1.2));
        String text = store.convertTemplateFilterToString(shared);

        assertThat(store.isValidTemplateFilter(text)).isTrue();
        assertThat(store.isValidTemplateFilter("filter-template:bm90IGpzb24")).isFalse();
        assertThat(store.isValidTemplateFilter(null)).isFalse();
        assertThat(store.addTemplateFilterFromString(text)).isEqualTo(shared);
        assertThat(store.getTemplateFilters()).containsExactly(shared);
    }

    @Test
    void skipsUnknownEntriesInAnExistingFile() throws Exception {
        Path file = tempDir.resolve("favorites.json");
        Files.writeString(file, """
                {"version": 1,
                 "favorites": ["SEPIA", "TELEPORT"],
                 "templates": [{"name": "Good", "filters": [{"kind": "INVERT"}]},
                               {"name": "Bad", "filters": [{"kind": "TELEPORT"}]}]}
                """);

        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(file);

        assertThat(store.getFavoriteFilters()).containsExactly(FilterKind.SEPIA);
        assertThat(store.getTemplateFilters()).extracting(TemplateFilter::getName).containsExactly("Good");
    }

    @Test
    void failedWriteLeavesTheStoreUnchanged() throws Exception {
        Path file = tempDir.resolve("favorites.json");
        JsonFavoriteFiltersStore store = new JsonFavoriteFiltersStore(file);
        TemplateFilter kept = new TemplateFilter("Kept", FilterChain.empty().then(FilterKind.INVERT));
        store.addFavoriteFilter(FilterKind.SEPIA);
        store.addTemplateFilter(kept);

        Files.delete(file);
        Files.createDirectories(file);
        Files.writeString(file.resolve("blocker"), "x");

        assertThatThrownBy(() -> store.addFavoriteFilter(FilterKind.HAZE)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.toggleFavoriteFilter(FilterKind.SEPIA)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.reorderFavoriteFilters(List.of(FilterKind.HAZE)))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.addTemplateFilter(new TemplateFilter("Other", FilterChain.empty())))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.removeTemplateFilter("Kept")).isInstanceOf(IOException.class);

        assertThat(store.isFavorite(FilterKind.HAZE)).isFalse();
        assertThat(store.getFavoriteFilters()).containsExactly(FilterKind.SEPIA);
        assertThat(store.getTemplateFilters()).containsExactly(kept);
    }

    @Test
    void malformedFavouritesAreReportedOrSkipped() throws Exception {
        Path objectEntry = tempDir.resolve("object-entry.json");
        Files.writeString(objectEntry, "{\"version\": 1, \"favorites\": [{}, null, \"SEPIA\"]}");
        assertThat(new JsonFavoriteFiltersStore(objectEntry).getFavoriteFilters())
                .containsExactly(FilterKind.SEPIA);

        Path notAnArray = tempDir.resolve("not-an-array.json");
        Files.writeString(notAnArray, "{\"version\": 1, \"favorites\": \"SEPIA\"}");
        assertThatThrownBy(() -> new JsonFavoriteFiltersStore(notAnArray))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid favorites file");

        Path templatesNotAnArray = tempDir.resolve("templates-object.json");
        Files.writeString(templatesNotAnArray, "{\"version\": 1, \"templates\": {}}");
        assertThatThrownBy(() -> new JsonFavoriteFiltersStore(templatesNotAnArray))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid favorites file");
    }

    @Test
    void templateNamesKeepOnlyLettersAndWhitespace() {
        assertThat(TemplateFilter.sanitizeName("  Café-Noir 2000! ")).isEqualTo("CaféNoir");
        assertThat(TemplateFilter.sanitizeName("Soft  Glow\t")).isEqualTo("Soft  Glow");
        assertThatThrownBy(() -> new TemplateFilter("1234", FilterChain.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
