package com.ttennebkram.imagefilter.persistence;

import com.ttennebkram.imagefilter.catalogue.EdgeMode;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;
import com.ttennebkram.imagefilter.mask.FillRule;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.mask.MaskPath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterChainSerializerTest {

    @TempDir
    Path tempDir;

    @Test
    void readsTheDocumentedChainFormat() throws Exception {
        FilterChain chain = FilterChainSerializer.fromJson("""
                {
                  "version": 1,
                  "filters": [
                    {"kind": "EXPOSURE", "params": [0.5]},
                    {"kind": "INVERT"},
                    {"kind": "Gaussian Blur", "params": [3, 2]}
                  ]
                }
                """);

        assertThat(chain.specs()).containsExactly(
                FilterSpec.of(FilterKind.EXPOSURE, 0.5),
                FilterSpec.of(FilterKind.INVERT),
                FilterSpec.of(FilterKind.GAUSSIAN_BLUR, 3, EdgeMode.WRAP.ordinal()));
    }

    @Test
    void savedChainsLoadBackUnchanged() throws Exception {
        FilterChain chain = FilterChain.empty()
                .then(FilterKind.HUE, 45)
                .then(FilterKind.PINCH, 90, 0.25, 0.75, 0.5, -0.3)
                .then(FilterKind.NEON, 2, 0.5, 0x33CC99)
                .then(FilterKind.CLOSING, 7, 0);
        Path file = tempDir.resolve("chain.json");

        FilterChainSerializer.save(file, chain);

        assertThat(Files.readString(file)).contains("\"kind\": \"PINCH\"");
        assertThat(FilterChainSerializer.load(file)).isEqualTo(chain);
    }

    @Test
    void clampsOutOfRangeValuesAndFillsMissingParams() throws Exception {
        FilterChain chain = FilterChainSerializer.fromJson(
                "{\"filters\": [{\"kind\": \"CONTRAST\", \"params\": [9.876]}, {\"kind\": \"VIGNETTE\"}]}");

        assertThat(chain.get(0)).isEqualTo(FilterSpec.of(FilterKind.CONTRAST, 4));
        assertThat(chain.get(1)).isEqualTo(FilterSpec.of(FilterKind.VIGNETTE));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> FilterChainSerializer.fromJson("{not json"))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Invalid chain file");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson("[1, 2]"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not a valid JSON object");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson("{\"version\": 1}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'filters'");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson("{\"filters\": [{\"kind\": \"LENS_FLARE\"}]}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("LENS_FLARE");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson(
                "{\"filters\": [{\"kind\": \"RGB\", \"params\": [1, 1]}]}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("expects 3");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson("{\"version\": 7, \"filters\": []}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("version 7");
        assertThatThrownBy(() -> FilterChainSerializer.fromJson(
                "{\"filters\": [{\"kind\": \"EXPOSURE\", \"params\": \"high\"}]}"))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Invalid chain file");
    }

    @Test
    void masksSurviveAJsonRoundTrip() throws Exception {
        Mask mask = Mask.builder(40, 30)
                .add(MaskPath.polygon(1, 1, 20, 2, 10, 25))
                .add(MaskPath.stroke(3, 5, 5, 35, 25))
                .add(MaskPath.rectangle(0, 0, 4, 4).asEraser())
                .fillRule(FillRule.EVEN_ODD)
                .inverted(true)
                .previewColor(0x00FF80)
                .build();
        Path file = tempDir.resolve("mask.json");

        FilterChainSerializer.saveMask(file, mask);

        assertThat(FilterChainSerializer.loadMask(file)).isEqualTo(mask);
        assertThat(FilterChainSerializer.maskToJson(mask)).contains("\"previewColor\": \"#00FF80\"");
    }

    @Test
    void rejectsMaskWithoutCanvas() {
        assertThatThrownBy(() -> FilterChainSerializer.maskFromJson("{\"paths\": []}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("width");
        assertThatThrownBy(() -> FilterChainSerializer.maskFromJson("{\"width\": 0, \"height\": 4}"))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Invalid mask file");
    }

    @Test
    void templatesExportToASingleLine() throws Exception {
        TemplateFilter template = new TemplateFilter("Warm Glow",
                FilterChain.empty().then(FilterKind.SEPIA, 0.4).then(FilterKind.VIGNETTE, 0.2, 0.8));

        String text = FilterChainSerializer.templateToString(template);

        assertThat(text).startsWith(FilterChainSerializer.TEMPLATE_PREFIX).doesNotContain("\n");
        assertThat(FilterChainSerializer.templateFromString("  " + text + "\n")).isEqualTo(template);
        assertThatThrownBy(() -> FilterChainSerializer.templateFromString("hello"))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> FilterChainSerializer.templateFromString(FilterChainSerializer.TEMPLATE_PREFIX + "%%%"))
                .isInstanceOf(IOException.class);
    }
}
