package com.ttennebkram.imagefilter.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imagefilter.catalogue.FilterCatalogue;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;
import com.ttennebkram.imagefilter.engine.ParameterValidator;
import com.ttennebkram.imagefilter.mask.FillRule;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.mask.MaskAnchor;
import com.ttennebkram.imagefilter.mask.MaskPath;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts filter chains, masks and templates to and from JSON documents.
 *
 * Chain format:
 * <pre>
 * {"version": 1, "filters": [{"kind": "EXPOSURE", "params": [0.5]}]}
 * </pre>
 * Loaded parameters are clamped and rounded to their declared ranges; a filter
 * without "params" gets its defaults.
 */
public class FilterChainSerializer {

    public static final int FORMAT_VERSION = 1;

    /** Prefix of the single-string template export */
    public static final String TEMPLATE_PREFIX = "filter-template:";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private FilterChainSerializer() {
    }

    // ---- chains ----

    public static String toJson(FilterChain chain) {
        return GSON.toJson(chainToTree(chain));
    }

    public static FilterChain fromJson(String json) throws IOException {
        return chainFromTree(parseObject(json, "chain"), "chain");
    }

    public static void save(Path path, FilterChain chain) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(chainToTree(chain), writer);
        }
    }

    public static FilterChain load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return chainFromTree(parseObject(reader, "chain"), "chain");
        }
    }

    static JsonObject chainToTree(FilterChain chain) {
        JsonObject root = new JsonObject();
        root.addProperty("version", FORMAT_VERSION);
        root.add("filters", filtersToJson(chain));
        return root;
    }

    static JsonArray filtersToJson(FilterChain chain) {
        JsonArray filters = new JsonArray();
        for (FilterSpec spec : chain) {
            JsonObject filter = new JsonObject();
            filter.addProperty("kind", spec.getKind().name());
            if (spec.getKind().hasParams()) {
                JsonArray params = new JsonArray();
                for (double value : spec.getParams().values()) {
                    params.add(value);
                }
                filter.add("params", params);
            }
            filters.add(filter);
        }
        return filters;
    }

    static FilterChain chainFromTree(JsonObject root, String what) throws IOException {
        checkVersion(root, what);
        if (!root.has("filters") || !root.get("filters").isJsonArray()) {
            throw new IOException("Invalid " + what + " file: missing 'filters' array");
        }
        return filtersFromJson(root.getAsJsonArray("filters"), what);
    }

    static FilterChain filtersFromJson(JsonArray filters, String what) throws IOException {
        List<FilterSpec> specs = new ArrayList<>();
        for (JsonElement element : filters) {
            if (!element.isJsonObject()) {
                throw new IOException("Invalid " + what + " file: filter entry is not an object");
            }
            try {
                specs.add(specFromJson(element.getAsJsonObject(), what));
            } catch (IllegalStateException | IllegalArgumentException | ClassCastException
                     | UnsupportedOperationException e) {
                throw new IOException("Invalid " + what + " file: " + e.getMessage(), e);
            }
        }
        return FilterChain.of(specs);
    }

    private static FilterSpec specFromJson(JsonObject filter, String what) throws IOException {
        if (!filter.has("kind")) {
            throw new IOException("Invalid " + what + " file: filter missing 'kind' field");
        }
        String kindName = filter.get("kind").getAsString();
        FilterKind kind = FilterCatalogue.findKind(kindName)
                .orElseThrow(() -> new IOException("Invalid " + what + " file: unknown filter kind '"
                        + kindName + "'"));

        FilterSpec spec;
        if (filter.has("params")) {
            JsonArray params = filter.getAsJsonArray("params");
            if (params.size() != kind.getArity()) {
                throw new IOException("Invalid " + what + " file: " + kind + " expects " + kind.getArity()
                        + " params, got " + params.size());
            }
            double[] values = new double[params.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = params.get(i).getAsDouble();
            }
            spec = FilterSpec.of(kind, values);
        } else {
            spec = FilterSpec.of(kind);
        }
        return ParameterValidator.validate(spec);
    }

    // ---- masks ----

    public static String maskToJson(Mask mask) {
        return GSON.toJson(maskToTree(mask));
    }

    public static Mask maskFromJson(String json) throws IOException {
        return maskFromTree(parseObject(json, "mask"));
    }

    public static Mask loadMask(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return maskFromTree(parseObject(reader, "mask"));
        }
    }

    public static void saveMask(Path path, Mask mask) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(maskToTree(mask), writer);
        }
    }

    static JsonObject maskToTree(Mask mask) {
        JsonObject root = new JsonObject();
        root.addProperty("version", FORMAT_VERSION);
        root.addProperty("width", mask.getWidth());
        root.addProperty("height", mask.getHeight());
        root.addProperty("fillRule", mask.getFillRule().name());
        root.addProperty("inverted", mask.isInverted());
        root.addProperty("previewColor", String.format("#%06X", mask.getPreviewColor()));

        JsonArray paths = new JsonArray();
        for (MaskPath path : mask.getPaths()) {
            JsonObject pathJson = new JsonObject();
            JsonArray anchors = new JsonArray();
            for (MaskAnchor anchor : path.getAnchors()) {
                JsonArray point = new JsonArray();
                point.add(anchor.getX());
                point.add(anchor.getY());
                anchors.add(point);
            }
            pathJson.add("anchors", anchors);
            pathJson.addProperty("closed", path.isClosed());
            pathJson.addProperty("strokeWidth", path.getStrokeWidth());
            pathJson.addProperty("erase", path.isErase());
            paths.add(pathJson);
        }
        root.add("paths", paths);
        return root;
    }

    static Mask maskFromTree(JsonObject root) throws IOException {
        checkVersion(root, "mask");
        if (!root.has("width") || !root.has("height")) {
            throw new IOException("Invalid mask file: missing canvas 'width' or 'height'");
        }
        try {
            Mask.Builder builder = Mask.builder(root.get("width").getAsInt(), root.get("height").getAsInt());
            if (root.has("fillRule")) {
                builder.fillRule(FillRule.valueOf(root.get("fillRule").getAsString()));
            }
            if (root.has("inverted")) {
                builder.inverted(root.get("inverted").getAsBoolean());
            }
            if (root.has("previewColor")) {
                builder.previewColor(parseColor(root.get("previewColor").getAsString()));
            }
            if (root.has("paths")) {
                for (JsonElement element : root.getAsJsonArray("paths")) {
                    builder.add(pathFromJson(element.getAsJsonObject()));
                }
            }
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new IOException("Invalid mask file: " + e.getMessage(), e);
        }
    }

    private static MaskPath pathFromJson(JsonObject json) {
        List<MaskAnchor> anchors = new ArrayList<>();
        if (json.has("anchors")) {
            for (JsonElement element : json.getAsJsonArray("anchors")) {
                JsonArray point = element.getAsJsonArray();
                anchors.add(new MaskAnchor(point.get(0).getAsDouble(), point.get(1).getAsDouble()));
            }
        }
        boolean closed = json.has("closed") && json.get("closed").getAsBoolean();
        double strokeWidth = json.has("strokeWidth") ? json.get("strokeWidth").getAsDouble() : 0;
        boolean erase = json.has("erase") && json.get("erase").getAsBoolean();
        return new MaskPath(anchors, closed, strokeWidth, erase);
    }

    private static int parseColor(String value) {
        String hex = value.startsWith("#") ? value.substring(1) : value;
        return Integer.parseInt(hex, 16) & 0xFFFFFF;
    }

    // ---- templates ----

    static JsonObject templateToTree(TemplateFilter template) {
        JsonObject json = new JsonObject();
        json.addProperty("name", template.getName());
        json.add("filters", filtersToJson(template.getChain()));
        return json;
    }

    static TemplateFilter templateFromTree(JsonObject json) throws IOException {
        if (!json.has("name") || !json.has("filters") || !json.get("filters").isJsonArray()) {
            throw new IOException("Invalid template: needs 'name' and 'filters'");
        }
        FilterChain chain = filtersFromJson(json.getAsJsonArray("filters"), "template");
        try {
            return new TemplateFilter(json.get("name").getAsString(), chain);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid template: " + e.getMessage(), e);
        }
    }

    /**
     * Single-line export of a template, suitable for sharing as text or a QR code.
     */
    public static String templateToString(TemplateFilter template) {
        JsonObject json = templateToTree(template);
        json.addProperty("version", FORMAT_VERSION);
        String compact = new Gson().toJson(json);
        return TEMPLATE_PREFIX + Base64.getUrlEncoder().withoutPadding()
                .encodeToString(compact.getBytes(StandardCharsets.UTF_8));
    }

    public static TemplateFilter templateFromString(String text) throws IOException {
        if (text == null || !text.trim().startsWith(TEMPLATE_PREFIX)) {
            throw new IOException("Invalid template: missing '" + TEMPLATE_PREFIX + "' prefix");
        }
        String encoded = text.trim().substring(TEMPLATE_PREFIX.length());
        String json;
        try {
            json = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid template: " + e.getMessage(), e);
        }
        JsonObject root = parseObject(json, "template");
        checkVersion(root, "template");
        return templateFromTree(root);
    }

    // ---- helpers ----

    static JsonObject parseObject(String json, String what) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new IOException("Invalid " + what + " file: not a valid JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid " + what + " file: " + e.getMessage(), e);
        }
    }

    static JsonObject parseObject(Reader reader, String what) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new IOException("Invalid " + what + " file: not a valid JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid " + what + " file: " + e.getMessage(), e);
        }
    }

    private static void checkVersion(JsonObject root, String what) throws IOException {
        if (root.has("version")) {
            int version = root.get("version").getAsInt();
            if (version > FORMAT_VERSION) {
                throw new IOException("Unsupported " + what + " file version " + version
                        + " (newest supported is " + FORMAT_VERSION + ")");
            }
        }
    }
}
