package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.backend.FilterBackend;
import com.ttennebkram.imagefilter.backend.JavaFilterBackend;
import com.ttennebkram.imagefilter.backend.OpenCvFilterBackend;
import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.cache.FilterCache;
import com.ttennebkram.imagefilter.catalogue.FilterCatalogue;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;
import com.ttennebkram.imagefilter.engine.CancellationSignal;
import com.ttennebkram.imagefilter.engine.ChainProgressListener;
import com.ttennebkram.imagefilter.engine.FilterExecutor;
import com.ttennebkram.imagefilter.engine.FilterJob;
import com.ttennebkram.imagefilter.engine.ParameterValidator;
import com.ttennebkram.imagefilter.mask.FilterMaskApplier;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.mask.MaskCompositor;
import com.ttennebkram.imagefilter.mask.MaskRasterizer;
import com.ttennebkram.imagefilter.mask.MaskedFilter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Entry point for hosts: wires allocator, backend, cache, executor and mask
 * compositor from {@link EngineSettings} and exposes the operations a UI needs.
 */
public class FilterEngine implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(FilterEngine.class.getName());

    private final BufferAllocator allocator;
    private final FilterExecutor executor;
    private final MaskCompositor compositor;
    private final FilterMaskApplier maskApplier;

    public FilterEngine() {
        this(EngineSettings.load());
    }

    public FilterEngine(EngineSettings settings) {
        this(settings, new TrackingBufferAllocator());
    }

    public FilterEngine(EngineSettings settings, BufferAllocator allocator) {
        this.allocator = allocator;
        FilterCache cache = new FilterCache(settings.getCacheMaxEntries(), settings.getCacheMaxBytes());
        cache.setEvictionListener(allocator::release);
        this.executor = new FilterExecutor(createBackend(settings, allocator), cache, allocator,
                settings.getMemoryCeilingBytes(), settings.getWorkerThreads());
        this.compositor = new MaskCompositor(new MaskRasterizer(settings.getMaskSamplesPerAxis()), allocator);
        this.maskApplier = new FilterMaskApplier(executor, compositor);
        LOGGER.fine(() -> "Engine ready: " + settings + ", backend " + executor.getBackend().getName());
    }

    /**
     * Assemble from prebuilt parts, for hosts that supply their own backend or cache.
     */
    public FilterEngine(FilterExecutor executor, MaskCompositor compositor) {
        this.allocator = executor.getAllocator();
        this.executor = executor;
        this.compositor = compositor;
        this.maskApplier = new FilterMaskApplier(executor, compositor);
    }

    static FilterBackend createBackend(EngineSettings settings, BufferAllocator allocator) {
        FilterBackend java = new JavaFilterBackend(allocator);
        if (settings.getBackend() == EngineSettings.Backend.OPENCV) {
            if (OpenCvFilterBackend.loadNativeLibrary()) {
                return new OpenCvFilterBackend(allocator, java);
            }
            LOGGER.warning("OpenCV backend requested but the native library is unavailable, using the java backend");
        }
        return java;
    }

    public List<FilterKind> catalogue() {
        return FilterCatalogue.getKinds();
    }

    public Map<String, List<FilterKind>> categories() {
        return FilterCatalogue.getCategories();
    }

    public FilterSpec validate(FilterSpec spec) {
        return ParameterValidator.validate(spec);
    }

    public PixelBuffer apply(FilterChain chain, PixelBuffer source) throws FilterExecutionException {
        return executor.apply(chain, source);
    }

    public PixelBuffer apply(FilterChain chain, PixelBuffer source, ChainProgressListener listener,
                             CancellationSignal signal) throws FilterExecutionException {
        return executor.apply(chain, source, listener, signal);
    }

    public FilterJob submit(FilterChain chain, PixelBuffer source, ChainProgressListener listener) {
        return executor.submit(chain, source, listener);
    }

    public PixelBuffer composite(PixelBuffer original, PixelBuffer filtered, Mask mask)
            throws AllocationFailureException {
        return compositor.composite(original, filtered, mask);
    }

    public PixelBuffer preview(PixelBuffer original, Mask mask) throws AllocationFailureException {
        return compositor.preview(original, mask);
    }

    public PixelBuffer applyMasks(PixelBuffer source, List<MaskedFilter> maskedFilters)
            throws FilterExecutionException {
        return maskApplier.applyMasks(source, maskedFilters);
    }

    public Future<PixelBuffer> submitMasks(PixelBuffer source, List<MaskedFilter> maskedFilters) {
        return maskApplier.submit(source, maskedFilters);
    }

    /**
     * Drop every cached result, for example when the host's source image changes.
     */
    public int clearCache() {
        FilterCache cache = executor.getCache();
        return cache == null ? 0 : cache.invalidateAll();
    }

    public BufferAllocator getAllocator() {
        return allocator;
    }

    public FilterExecutor getExecutor() {
        return executor;
    }

    public MaskCompositor getCompositor() {
        return compositor;
    }

    @Override
    public void close() {
        executor.close();
        clearCache();
    }
}
