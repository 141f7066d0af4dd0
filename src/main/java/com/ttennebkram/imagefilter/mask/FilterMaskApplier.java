package com.ttennebkram.imagefilter.mask;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.cache.FilterCache;
import com.ttennebkram.imagefilter.engine.FilterExecutor;

import java.util.List;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Applies a sequence of masked filters: each chain runs over the previous result
 * and is composited back through its mask.
 */
public class FilterMaskApplier {

    private static final Logger LOGGER = Logger.getLogger(FilterMaskApplier.class.getName());

    private final FilterExecutor executor;
    private final MaskCompositor compositor;

    public FilterMaskApplier(FilterExecutor executor, MaskCompositor compositor) {
        this.executor = executor;
        this.compositor = compositor;
    }

    /**
     * @return the final composite, or the source itself when the list is empty
     */
    public PixelBuffer applyMasks(PixelBuffer source, List<MaskedFilter> maskedFilters)
            throws FilterExecutionException {
        PixelBuffer current = source;
        for (MaskedFilter maskedFilter : maskedFilters) {
            Mask mask = maskedFilter.getMask();
            if (mask.getWidth() != source.getWidth() || mask.getHeight() != source.getHeight()) {
                throw new DimensionMismatchException("Mask canvas " + mask.getWidth() + "x" + mask.getHeight()
                        + " does not match " + source);
            }
            PixelBuffer filtered = executor.apply(maskedFilter.getChain(), current);
            PixelBuffer composited;
            try {
                composited = compositor.composite(current, filtered, mask);
            } finally {
                release(filtered, current, source);
            }
            release(current, null, source);
            current = composited;
            LOGGER.finer(() -> "Applied " + maskedFilter);
        }
        return current;
    }

    /**
     * Run {@link #applyMasks} on the executor's worker pool.
     */
    public Future<PixelBuffer> submit(PixelBuffer source, List<MaskedFilter> maskedFilters) {
        List<MaskedFilter> copy = List.copyOf(maskedFilters);
        return executor.submitTask(() -> applyMasks(source, copy));
    }

    private void release(PixelBuffer buffer, PixelBuffer keep, PixelBuffer source) {
        if (buffer == source || buffer == keep) {
            return;
        }
        FilterCache cache = executor.getCache();
        if (cache != null && cache.isResident(buffer)) {
            return;
        }
        executor.getAllocator().release(buffer);
    }
}
