package com.ttennebkram.imagefilter.mask;

import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaskCompositorTest {

    private final TrackingBufferAllocator allocator = new TrackingBufferAllocator();
    private final MaskCompositor compositor = new MaskCompositor(new MaskRasterizer(4), allocator);

    private final PixelBuffer original = PixelBuffer.filled(4, 2, ChannelLayout.RGBA, 10, 20, 30, 255);
    private final PixelBuffer filtered = PixelBuffer.filled(4, 2, ChannelLayout.RGBA, 200, 150, 100, 128);

    @Test
    void zeroCoverageReproducesTheOriginalExactly() throws Exception {
        PixelBuffer out = compositor.composite(original, filtered, Mask.empty(4, 2));

        assertThat(out.contentEquals(original)).isTrue();
        assertThat(out).isNotSameAs(original);
    }

    @Test
    void fullCoverageReproducesTheFilteredImageExactly() throws Exception {
        PixelBuffer out = compositor.composite(original, filtered, Mask.full(4, 2));

        assertThat(out.contentEquals(filtered)).isTrue();
    }

    @Test
    void partialCoverageBlendsEveryChannelIncludingAlpha() throws Exception {
        PixelBuffer black = PixelBuffer.filled(4, 1, ChannelLayout.RGBA, 0, 0, 0, 0);
        PixelBuffer white = PixelBuffer.filled(4, 1, ChannelLayout.RGBA, 255, 255, 255, 255);

        PixelBuffer out = compositor.composite(black, white, Mask.rectangle(4, 1, 0, 0, 2.5, 1));

        assertThat(out.get(1, 0, 0)).isEqualTo(255);
        assertThat(out.get(2, 0, 0)).isEqualTo(128);
        assertThat(out.get(2, 0, 3)).isEqualTo(128);
        assertThat(out.get(3, 0, 0)).isZero();
    }

    @Test
    void invertedMaskSelectsTheComplement() throws Exception {
        Mask left = Mask.rectangle(4, 2, 0, 0, 2, 2);

        PixelBuffer out = compositor.composite(original, filtered, left.inverse());

        assertThat(out.get(0, 0, 0)).isEqualTo(10);
        assertThat(out.get(3, 1, 0)).isEqualTo(200);
    }

    @Test
    void rejectsMismatchedSizes() {
        PixelBuffer small = PixelBuffer.filled(2, 2, ChannelLayout.RGBA, 0, 0, 0, 0);

        assertThatThrownBy(() -> compositor.composite(original, small, Mask.full(4, 2)))
                .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> compositor.composite(original, filtered, Mask.full(5, 2)))
                .isInstanceOf(DimensionMismatchException.class);
        PixelBuffer rgb = PixelBuffer.filled(4, 2, ChannelLayout.RGB, 0, 0, 0);
        assertThatThrownBy(() -> compositor.composite(original, rgb, Mask.full(4, 2)))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void previewTintsCoveredPixelsAtHalfOpacity() throws Exception {
        PixelBuffer black = PixelBuffer.filled(2, 1, ChannelLayout.RGB, 0, 0, 0);
        Mask mask = Mask.builder(2, 1)
                .add(MaskPath.rectangle(0, 0, 1, 1))
                .previewColor(0xFF0000)
                .build();

        PixelBuffer out = compositor.preview(black, mask);

        assertThat(out.get(0, 0, 0)).isEqualTo(128);
        assertThat(out.get(0, 0, 1)).isZero();
        assertThat(out.get(1, 0, 0)).isZero();
    }
}
