package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.AdaptiveEqualizeParams;
import com.ttennebkram.imagefilter.catalogue.ClaheParams;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;
import com.ttennebkram.imagefilter.catalogue.GaussianBlurParams;
import com.ttennebkram.imagefilter.catalogue.MorphologyParams;
import com.ttennebkram.imagefilter.catalogue.NeonParams;
import com.ttennebkram.imagefilter.catalogue.PairParams;
import com.ttennebkram.imagefilter.catalogue.PinchParams;
import com.ttennebkram.imagefilter.catalogue.QuadParams;
import com.ttennebkram.imagefilter.catalogue.ScalarParams;
import com.ttennebkram.imagefilter.catalogue.TripleParams;
import com.ttennebkram.imagefilter.catalogue.ZoomBlurParams;
import com.ttennebkram.imagefilter.filters.BokehFilter;
import com.ttennebkram.imagefilter.filters.BoxBlurFilter;
import com.ttennebkram.imagefilter.filters.BrightnessFilter;
import com.ttennebkram.imagefilter.filters.ClaheFilter;
import com.ttennebkram.imagefilter.filters.ColorHalftoneFilter;
import com.ttennebkram.imagefilter.filters.CompositeFilter;
import com.ttennebkram.imagefilter.filters.ContrastFilter;
import com.ttennebkram.imagefilter.filters.CrosshatchFilter;
import com.ttennebkram.imagefilter.filters.EqualizeFilter;
import com.ttennebkram.imagefilter.filters.ExposureFilter;
import com.ttennebkram.imagefilter.filters.GammaFilter;
import com.ttennebkram.imagefilter.filters.GaussianBlurFilter;
import com.ttennebkram.imagefilter.filters.GrayscaleFilter;
import com.ttennebkram.imagefilter.filters.HazeFilter;
import com.ttennebkram.imagefilter.filters.HueFilter;
import com.ttennebkram.imagefilter.filters.InvertFilter;
import com.ttennebkram.imagefilter.filters.MedianBlurFilter;
import com.ttennebkram.imagefilter.filters.MorphologyFilter;
import com.ttennebkram.imagefilter.filters.PinchFilter;
import com.ttennebkram.imagefilter.filters.PixelTransformation;
import com.ttennebkram.imagefilter.filters.PixelateFilter;
import com.ttennebkram.imagefilter.filters.PosterizeFilter;
import com.ttennebkram.imagefilter.filters.RgbFilter;
import com.ttennebkram.imagefilter.filters.SaturationFilter;
import com.ttennebkram.imagefilter.filters.SepiaFilter;
import com.ttennebkram.imagefilter.filters.SharpenFilter;
import com.ttennebkram.imagefilter.filters.SobelEdgeFilter;
import com.ttennebkram.imagefilter.filters.SolarizeFilter;
import com.ttennebkram.imagefilter.filters.TentBlurFilter;
import com.ttennebkram.imagefilter.filters.ThresholdFilter;
import com.ttennebkram.imagefilter.filters.VignetteFilter;
import com.ttennebkram.imagefilter.filters.ZoomBlurFilter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pure Java reference backend. Supports every kind and is deterministic on
 * every platform.
 */
public class JavaFilterBackend implements FilterBackend {

    private static final Logger LOGGER = Logger.getLogger(JavaFilterBackend.class.getName());

    private final BufferAllocator allocator;

    public JavaFilterBackend(BufferAllocator allocator) {
        this.allocator = allocator;
    }

    @Override
    public String getName() {
        return "java";
    }

    @Override
    public boolean supports(FilterKind kind) {
        return true;
    }

    @Override
    public PixelBuffer transform(FilterKind kind, FilterParams params, PixelBuffer source)
            throws AllocationFailureException, FilterBackendException {
        PixelTransformation transformation = createTransformation(kind, params);
        try {
            return transformation.apply(source, allocator);
        } catch (AllocationFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, kind + " failed on " + source, e);
            throw new FilterBackendException(kind + " failed: " + e.getMessage(), kind, e);
        }
    }

    /**
     * Build the transformation for a kind and its payload.
     */
    public static PixelTransformation createTransformation(FilterKind kind, FilterParams params) {
        return switch (kind) {
            case BRIGHTNESS -> new BrightnessFilter(scalar(params));
            case CONTRAST -> new ContrastFilter(scalar(params));
            case EXPOSURE -> new ExposureFilter(scalar(params));
            case GAMMA -> new GammaFilter(scalar(params));
            case POSTERIZE -> new PosterizeFilter((int) Math.round(scalar(params)));
            case SOLARIZE -> new SolarizeFilter(scalar(params));
            case THRESHOLD -> new ThresholdFilter(scalar(params));
            case SATURATION -> new SaturationFilter(scalar(params));
            case HUE -> new HueFilter(scalar(params));
            case RGB -> {
                TripleParams p = (TripleParams) params;
                yield new RgbFilter(p.getFirst(), p.getSecond(), p.getThird());
            }
            case INVERT -> new InvertFilter();
            case GRAYSCALE -> new GrayscaleFilter();
            case SEPIA -> new SepiaFilter(scalar(params));
            case HAZE -> {
                PairParams p = (PairParams) params;
                yield new HazeFilter(p.getFirst(), p.getSecond());
            }
            case VIGNETTE -> {
                PairParams p = (PairParams) params;
                yield new VignetteFilter(p.getFirst(), p.getSecond());
            }
            case CROSSHATCH -> {
                PairParams p = (PairParams) params;
                yield new CrosshatchFilter(p.getFirst(), p.getSecond());
            }
            case PIXELATE -> new PixelateFilter((int) Math.round(scalar(params)));
            case COLOR_HALFTONE -> {
                QuadParams p = (QuadParams) params;
                yield new ColorHalftoneFilter(p.getFirst(), p.getSecond(), p.getThird(), p.getFourth());
            }
            case NEON -> {
                NeonParams p = (NeonParams) params;
                yield CompositeFilter.neon(p.getLineSize(), p.getSharpness(), p.getRed(), p.getGreen(), p.getBlue());
            }
            case PINCH -> new PinchFilter((PinchParams) params);
            case GAUSSIAN_BLUR -> {
                GaussianBlurParams p = (GaussianBlurParams) params;
                yield new GaussianBlurFilter(p.getRadius(), p.getEdgeMode());
            }
            case BOX_BLUR -> new BoxBlurFilter((int) Math.round(scalar(params)));
            case TENT_BLUR -> new TentBlurFilter((int) Math.round(scalar(params)));
            case MEDIAN_BLUR -> new MedianBlurFilter((int) Math.round(scalar(params)));
            case BOKEH -> {
                PairParams p = (PairParams) params;
                yield new BokehFilter((int) Math.round(p.getFirst()), (int) Math.round(p.getSecond()));
            }
            case ZOOM_BLUR -> new ZoomBlurFilter((ZoomBlurParams) params);
            case SHARPEN -> new SharpenFilter(scalar(params));
            case SOBEL_EDGE_DETECTION -> new SobelEdgeFilter(scalar(params));
            case DILATION -> morphology(MorphologyFilter.Operation.DILATE, params);
            case EROSION -> morphology(MorphologyFilter.Operation.ERODE, params);
            case OPENING -> morphology(MorphologyFilter.Operation.OPEN, params);
            case CLOSING -> morphology(MorphologyFilter.Operation.CLOSE, params);
            case EQUALIZE -> new EqualizeFilter();
            case CLAHE -> new ClaheFilter((ClaheParams) params);
            case EQUALIZE_HISTOGRAM_ADAPTIVE -> new ClaheFilter(((AdaptiveEqualizeParams) params).toClahe());
        };
    }

    private static double scalar(FilterParams params) {
        return ((ScalarParams) params).getValue();
    }

    private static PixelTransformation morphology(MorphologyFilter.Operation operation, FilterParams params) {
        MorphologyParams p = (MorphologyParams) params;
        return new MorphologyFilter(operation, p.getSize(), p.isCircle());
    }
}
