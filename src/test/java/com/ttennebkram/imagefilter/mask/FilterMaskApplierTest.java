package com.ttennebkram.imagefilter.mask;

import com.ttennebkram.imagefilter.backend.JavaFilterBackend;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.engine.FilterExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterMaskApplierTest {

    private TrackingBufferAllocator allocator;
    private FilterExecutor executor;
    private FilterMaskApplier applier;

    @BeforeEach
    void setUp() {
        allocator = new TrackingBufferAllocator();
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        applier = new FilterMaskApplier(executor, new MaskCompositor(new MaskRasterizer(), allocator));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void appliesEachChainOnlyInsideItsMask() throws Exception {
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);
        List<MaskedFilter> layers = List.of(
                new MaskedFilter(Mask.rectangle(4, 4, 0, 0, 2, 4), FilterChain.empty().then(FilterKind.INVERT)),
                new MaskedFilter(Mask.rectangle(4, 4, 0, 0, 4, 2), FilterChain.empty().then(FilterKind.EXPOSURE, 0.5)));

        PixelBuffer out = applier.applyMasks(source, layers);

        assertThat(out.get(0, 3, 0)).isEqualTo(155);
        assertThat(out.get(3, 3, 0)).isEqualTo(100);
        assertThat(out.get(3, 0, 0)).isEqualTo(141);
        assertThat(out.get(0, 0, 0)).isEqualTo(219);
        assertThat(allocator.getActiveCount()).isEqualTo(1);
    }

    @Test
    void noLayersReturnsTheSource() throws Exception {
        PixelBuffer source = PixelBuffer.filled(2, 2, ChannelLayout.RGB, 1, 2, 3);

        assertThat(applier.applyMasks(source, List.of())).isSameAs(source);
    }

    @Test
    void rejectsMaskForAnotherCanvasSize() {
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 0);

        assertThatThrownBy(() -> applier.applyMasks(source,
                List.of(new MaskedFilter(Mask.full(3, 3), FilterChain.empty().then(FilterKind.INVERT)))))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void runsOnTheWorkerPool() throws Exception {
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);

        PixelBuffer out = applier.submit(source,
                        List.of(new MaskedFilter(Mask.full(4, 4), FilterChain.empty().then(FilterKind.INVERT))))
                .get(5, TimeUnit.SECONDS);

        assertThat(out.get(2, 2, 0)).isEqualTo(155);
    }
}
