package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.AdaptiveEqualizeParams;
import com.ttennebkram.imagefilter.catalogue.ClaheParams;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;
import com.ttennebkram.imagefilter.catalogue.GaussianBlurParams;
import com.ttennebkram.imagefilter.catalogue.MorphologyParams;
import com.ttennebkram.imagefilter.catalogue.ScalarParams;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend that runs the kinds OpenCV offers natively through {@link Mat}s and
 * hands everything else to a fallback backend.
 *
 * The native library must be loaded first, see {@link #loadNativeLibrary()}.
 */
public class OpenCvFilterBackend implements FilterBackend {

    private static final Logger LOGGER = Logger.getLogger(OpenCvFilterBackend.class.getName());

    private static final Set<FilterKind> NATIVE_KINDS = EnumSet.of(
            FilterKind.GAUSSIAN_BLUR, FilterKind.BOX_BLUR, FilterKind.MEDIAN_BLUR,
            FilterKind.INVERT, FilterKind.EQUALIZE, FilterKind.CLAHE, FilterKind.EQUALIZE_HISTOGRAM_ADAPTIVE,
            FilterKind.DILATION, FilterKind.EROSION, FilterKind.OPENING, FilterKind.CLOSING);

    private static volatile Boolean nativeLoaded;

    private final BufferAllocator allocator;
    private final FilterBackend fallback;

    public OpenCvFilterBackend(BufferAllocator allocator, FilterBackend fallback) {
        this.allocator = allocator;
        this.fallback = fallback;
    }

    /**
     * Load the bundled OpenCV native library once.
     *
     * @return false if the library is not available on this platform
     */
    public static synchronized boolean loadNativeLibrary() {
        if (nativeLoaded == null) {
            try {
                nu.pattern.OpenCV.loadLocally();
                nativeLoaded = Boolean.TRUE;
                LOGGER.fine(() -> "Loaded OpenCV " + Core.VERSION);
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                LOGGER.log(Level.WARNING, "OpenCV native library not available", e);
                nativeLoaded = Boolean.FALSE;
            }
        }
        return nativeLoaded;
    }

    @Override
    public String getName() {
        return "opencv";
    }

    @Override
    public boolean supports(FilterKind kind) {
        return NATIVE_KINDS.contains(kind) || (fallback != null && fallback.supports(kind));
    }

    /**
     * True if the kind runs natively for the given layout rather than through the fallback.
     */
    public boolean runsNatively(FilterKind kind, ChannelLayout layout) {
        if (!NATIVE_KINDS.contains(kind)) {
            return false;
        }
        return switch (kind) {
            // these would touch alpha
            case INVERT, EQUALIZE, DILATION, EROSION, OPENING, CLOSING -> !layout.hasAlpha();
            default -> true;
        };
    }

    @Override
    public PixelBuffer transform(FilterKind kind, FilterParams params, PixelBuffer source)
            throws FilterExecutionException {
        if (!runsNatively(kind, source.getLayout()) || !nativeParamsSupported(kind, params)) {
            if (fallback == null) {
                throw new UnsupportedFilterKindException(kind, getName());
            }
            return fallback.transform(kind, params, source);
        }

        Mat input = BufferMats.toMat(source);
        Mat output = new Mat();
        try {
            process(kind, params, input, output, source.getLayout());
            return BufferMats.fromMat(output, source, allocator);
        } catch (AllocationFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, kind + " failed in OpenCV on " + source, e);
            throw new FilterBackendException(kind + " failed in OpenCV: " + e.getMessage(), kind, e);
        } finally {
            input.release();
            output.release();
        }
    }

    private static boolean nativeParamsSupported(FilterKind kind, FilterParams params) {
        // OpenCV filters have no wrap-around border
        return !(params instanceof GaussianBlurParams p) || p.getEdgeMode() != EdgeMode.WRAP;
    }

    private void process(FilterKind kind, FilterParams params, Mat input, Mat output, ChannelLayout layout) {
        switch (kind) {
            case GAUSSIAN_BLUR: {
                GaussianBlurParams p = (GaussianBlurParams) params;
                int ksize = 2 * p.getRadius() + 1;
                double sigma = Math.max(p.getRadius() / 3.0, 0.5);
                Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), sigma, sigma, borderType(p.getEdgeMode()));
                break;
            }
            case BOX_BLUR: {
                int ksize = 2 * (int) Math.round(((ScalarParams) params).getValue()) + 1;
                Imgproc.blur(input, output, new Size(ksize, ksize), new Point(-1, -1), Core.BORDER_REFLECT_101);
                break;
            }
            case MEDIAN_BLUR: {
                int ksize = 2 * (int) Math.round(((ScalarParams) params).getValue()) + 1;
                Imgproc.medianBlur(input, output, ksize);
                break;
            }
            case INVERT:
                Core.bitwise_not(input, output);
                break;
            case EQUALIZE:
                perChannel(input, output, Imgproc::equalizeHist);
                break;
            case CLAHE:
                clahe((ClaheParams) params, input, output, layout);
                break;
            case EQUALIZE_HISTOGRAM_ADAPTIVE:
                clahe(((AdaptiveEqualizeParams) params).toClahe(), input, output, layout);
                break;
            case DILATION:
            case EROSION:
            case OPENING:
            case CLOSING:
                morphology(kind, (MorphologyParams) params, input, output);
                break;
            default:
                throw new UnsupportedFilterKindException(kind, getName());
        }
    }

    private static int borderType(EdgeMode mode) {
        return switch (mode) {
            case CLAMP -> Core.BORDER_REPLICATE;
            case REFLECT -> Core.BORDER_REFLECT;
            case WRAP -> Core.BORDER_WRAP;
            case REFLECT_101 -> Core.BORDER_REFLECT_101;
        };
    }

    private static void morphology(FilterKind kind, MorphologyParams params, Mat input, Mat output) {
        int shape = params.isCircle() ? Imgproc.MORPH_ELLIPSE : Imgproc.MORPH_RECT;
        Mat kernel = Imgproc.getStructuringElement(shape, new Size(params.getSize(), params.getSize()));
        int op = switch (kind) {
            case DILATION -> Imgproc.MORPH_DILATE;
            case EROSION -> Imgproc.MORPH_ERODE;
            case OPENING -> Imgproc.MORPH_OPEN;
            default -> Imgproc.MORPH_CLOSE;
        };
        try {
            Imgproc.morphologyEx(input, output, op, kernel);
        } finally {
            kernel.release();
        }
    }

    private static void clahe(ClaheParams params, Mat input, Mat output, ChannelLayout layout) {
        CLAHE clahe = Imgproc.createCLAHE(params.getClipLimit(),
                new Size(params.getGridSizeX(), params.getGridSizeY()));
        if (layout == ChannelLayout.GRAY) {
            clahe.apply(input, output);
            return;
        }

        List<Mat> channels = new ArrayList<>();
        Core.split(input, channels);
        Mat rgb = new Mat();
        Mat ycrcb = new Mat();
        List<Mat> planes = new ArrayList<>();
        Mat equalized = new Mat();
        try {
            Core.merge(channels.subList(0, 3), rgb);
            Imgproc.cvtColor(rgb, ycrcb, Imgproc.COLOR_RGB2YCrCb);
            Core.split(ycrcb, planes);
            clahe.apply(planes.get(0), equalized);
            planes.get(0).release();
            planes.set(0, equalized);
            Core.merge(planes, ycrcb);
            Imgproc.cvtColor(ycrcb, rgb, Imgproc.COLOR_YCrCb2RGB);
            if (layout.hasAlpha()) {
                List<Mat> rgba = new ArrayList<>();
                Core.split(rgb, rgba);
                rgba.add(channels.get(3));
                Core.merge(rgba, output);
                for (int i = 0; i < 3; i++) {
                    rgba.get(i).release();
                }
            } else {
                rgb.copyTo(output);
            }
        } finally {
            for (Mat m : channels) m.release();
            for (Mat m : planes) m.release();
            rgb.release();
            ycrcb.release();
        }
    }

    private interface MatOp {
        void apply(Mat src, Mat dst);
    }

    private static void perChannel(Mat input, Mat output, MatOp op) {
        List<Mat> channels = new ArrayList<>();
        List<Mat> results = new ArrayList<>();
        Core.split(input, channels);
        try {
            for (Mat channel : channels) {
                Mat result = new Mat();
                results.add(result);
                op.apply(channel, result);
            }
            Core.merge(results, output);
        } finally {
            for (Mat m : channels) m.release();
            for (Mat m : results) m.release();
        }
    }
}
