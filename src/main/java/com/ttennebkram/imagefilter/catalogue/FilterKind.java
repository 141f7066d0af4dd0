package com.ttennebkram.imagefilter.catalogue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Closed set of parameterized filters the engine understands.
 *
 * Each constant carries its display name, category, default payload and the
 * ordered {@link ParamInfo} descriptors of its payload components.
 */
public enum FilterKind {

    // Tone
    BRIGHTNESS("Brightness", "Tone", new ScalarParams(0),
            ParamInfo.of("brightness", -1, 1)),
    CONTRAST("Contrast", "Tone", new ScalarParams(1),
            ParamInfo.of("contrast", 0, 4)),
    EXPOSURE("Exposure", "Tone", new ScalarParams(0),
            ParamInfo.of("exposure", -10, 10)),
    GAMMA("Gamma", "Tone", new ScalarParams(1),
            ParamInfo.of("gamma", 0, 3)),
    POSTERIZE("Posterize", "Tone", new ScalarParams(10),
            ParamInfo.of("levels", 1, 256, 0)),
    SOLARIZE("Solarize", "Tone", new ScalarParams(0.5),
            ParamInfo.of("threshold", 0, 1)),
    THRESHOLD("Threshold", "Tone", new ScalarParams(0.5),
            ParamInfo.of("threshold", 0, 1)),

    // Color
    SATURATION("Saturation", "Color", new ScalarParams(1),
            ParamInfo.of("saturation", 0, 2)),
    HUE("Hue", "Color", new ScalarParams(90),
            ParamInfo.of("angle", 0, 360, 0)),
    RGB("RGB", "Color", new TripleParams(1, 1, 1),
            ParamInfo.of("red", 0, 1),
            ParamInfo.of("green", 0, 1),
            ParamInfo.of("blue", 0, 1)),
    INVERT("Invert", "Color", NoParams.INSTANCE),
    GRAYSCALE("Grayscale", "Color", NoParams.INSTANCE),
    SEPIA("Sepia", "Color", new ScalarParams(1),
            ParamInfo.of("intensity", 0, 1)),

    // Effects
    HAZE("Haze", "Effects", new PairParams(0.2, 0),
            ParamInfo.of("distance", -0.3, 0.3),
            ParamInfo.of("slope", -0.3, 0.3)),
    VIGNETTE("Vignette", "Effects", new PairParams(0.3, 0.75),
            ParamInfo.of("start", 0, 1),
            ParamInfo.of("end", 0, 1)),
    CROSSHATCH("Crosshatch", "Effects", new PairParams(0.01, 0.003),
            ParamInfo.of("spacing", 0.001, 0.05, 4),
            ParamInfo.of("lineWidth", 0.001, 0.02, 4)),
    PIXELATE("Pixelate", "Effects", new ScalarParams(10),
            ParamInfo.of("blockSize", 1, 100, 0)),
    COLOR_HALFTONE("Color Halftone", "Effects", new QuadParams(2, 108, 162, 90),
            ParamInfo.of("dotRadius", 1, 20),
            ParamInfo.of("cyanAngle", 0, 360, 0),
            ParamInfo.of("magentaAngle", 0, 360, 0),
            ParamInfo.of("yellowAngle", 0, 360, 0)),
    NEON("Neon", "Effects", new NeonParams(1, 0.26, 0xFF00FF),
            ParamInfo.of("lineSize", 1, 5),
            ParamInfo.of("sharpness", -4, 4),
            ParamInfo.of("color", 0, 0xFFFFFF, 0)),

    // Distortion
    PINCH("Pinch", "Distortion", new PinchParams(90, 0.5, 0.5, 0.5, 0.5),
            ParamInfo.of("angle", 0, 360, 0),
            ParamInfo.of("centerX", 0, 1),
            ParamInfo.of("centerY", 0, 1),
            ParamInfo.of("radius", 0, 2),
            ParamInfo.of("amount", -1, 1)),

    // Blur
    GAUSSIAN_BLUR("Gaussian Blur", "Blur", new GaussianBlurParams(10, EdgeMode.REFLECT_101),
            ParamInfo.of("radius", 1, 300, 0),
            ParamInfo.of("edgeMode", 0, EdgeMode.values().length - 1, 0)),
    BOX_BLUR("Box Blur", "Blur", new ScalarParams(5),
            ParamInfo.of("radius", 1, 100, 0)),
    TENT_BLUR("Tent Blur", "Blur", new ScalarParams(15),
            ParamInfo.of("size", 1, 101, 0)),
    MEDIAN_BLUR("Median Blur", "Blur", new ScalarParams(2),
            ParamInfo.of("radius", 1, 20, 0)),
    BOKEH("Bokeh", "Blur", new PairParams(6, 6),
            ParamInfo.of("size", 1, 150, 0),
            ParamInfo.of("blades", 3, 40, 0)),
    ZOOM_BLUR("Zoom Blur", "Blur", new ZoomBlurParams(25, 5, 0.5, 0.5, 1, 135),
            ParamInfo.of("radius", 1, 100, 0),
            ParamInfo.of("sigma", 1, 50),
            ParamInfo.of("centerX", 0, 1),
            ParamInfo.of("centerY", 0, 1),
            ParamInfo.of("strength", 0, 2),
            ParamInfo.of("angle", 0, 360, 0)),

    // Edges
    SHARPEN("Sharpen", "Edges", new ScalarParams(0),
            ParamInfo.of("sharpness", -4, 4)),
    SOBEL_EDGE_DETECTION("Sobel Edge Detection", "Edges", new ScalarParams(1),
            ParamInfo.of("lineSize", 1, 5)),

    // Morphology
    DILATION("Dilation", "Morphology", new MorphologyParams(25, true), morphologyInfo()),
    EROSION("Erosion", "Morphology", new MorphologyParams(25, true), morphologyInfo()),
    OPENING("Opening", "Morphology", new MorphologyParams(25, true), morphologyInfo()),
    CLOSING("Closing", "Morphology", new MorphologyParams(25, true), morphologyInfo()),

    // Histogram
    EQUALIZE("Equalize", "Histogram", NoParams.INSTANCE),
    CLAHE("CLAHE", "Histogram", new ClaheParams(2, 8, 8, 128),
            ParamInfo.of("clipLimit", 0, 10),
            ParamInfo.of("gridSizeX", 1, 100, 0),
            ParamInfo.of("gridSizeY", 1, 100, 0),
            ParamInfo.of("bins", 2, 256, 0)),
    EQUALIZE_HISTOGRAM_ADAPTIVE("Adaptive Equalize", "Histogram", new AdaptiveEqualizeParams(3, 3, 128),
            ParamInfo.of("gridSizeX", 1, 100, 0),
            ParamInfo.of("gridSizeY", 1, 100, 0),
            ParamInfo.of("bins", 2, 256, 0));

    private final String displayName;
    private final String category;
    private final FilterParams defaultParams;
    private final List<ParamInfo> params;

    FilterKind(String displayName, String category, FilterParams defaultParams, ParamInfo... params) {
        if (defaultParams.arity() != params.length) {
            throw new IllegalArgumentException(name() + ": default payload has " + defaultParams.arity()
                    + " components but " + params.length + " descriptors");
        }
        this.displayName = displayName;
        this.category = category;
        this.defaultParams = defaultParams;
        this.params = Collections.unmodifiableList(Arrays.asList(params));
    }

    private static ParamInfo[] morphologyInfo() {
        return new ParamInfo[]{
                ParamInfo.of("size", 1, 150, 0),
                ParamInfo.of("circle", 0, 1, 0)
        };
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCategory() {
        return category;
    }

    public ParamShape getShape() {
        return defaultParams.getShape();
    }

    /**
     * Payload type this kind accepts. Payloads of any other class are rejected.
     */
    public Class<? extends FilterParams> getParamsType() {
        return defaultParams.getClass();
    }

    public FilterParams getDefaultParams() {
        return defaultParams;
    }

    public List<ParamInfo> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    public boolean hasParams() {
        return !params.isEmpty();
    }
}
