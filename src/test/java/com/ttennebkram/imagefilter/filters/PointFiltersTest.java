package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PointFiltersTest {

    private final TrackingBufferAllocator allocator = new TrackingBufferAllocator();

    @Test
    void invertKeepsAlpha() throws Exception {
        PixelBuffer source = PixelBuffer.filled(3, 3, ChannelLayout.RGBA, 0, 100, 255, 77);

        PixelBuffer out = new InvertFilter().apply(source, allocator);

        assertThat(pixel(out)).containsExactly(255, 155, 0, 77);
        assertThat(pixel(source)).containsExactly(0, 100, 255, 77);
    }

    @Test
    void grayscaleUsesRec709Weights() throws Exception {
        PixelBuffer source = PixelBuffer.filled(1, 1, ChannelLayout.RGB, 255, 0, 0);

        PixelBuffer out = new GrayscaleFilter().apply(source, allocator);

        // 0.2125 * 255 = 54.19
        assertThat(pixel(out)).containsExactly(54, 54, 54);
    }

    @Test
    void grayInputStaysGray() throws Exception {
        PixelBuffer source = PixelBuffer.filled(2, 2, ChannelLayout.GRAY, 100);

        PixelBuffer brightened = new BrightnessFilter(0.2).apply(source, allocator);
        PixelBuffer tinted = new RgbFilter(1, 0, 0).apply(source, allocator);

        assertThat(brightened.getLayout()).isEqualTo(ChannelLayout.GRAY);
        assertThat(brightened.get(1, 1, 0)).isEqualTo(151);
        // red only survives: luminance of (100, 0, 0)
        assertThat(tinted.get(0, 0, 0)).isEqualTo(21);
    }

    @Test
    void thresholdAndSolarizeSplitOnLuminance() throws Exception {
        PixelBuffer dark = PixelBuffer.filled(1, 1, ChannelLayout.GRAY, 50);
        PixelBuffer light = PixelBuffer.filled(1, 1, ChannelLayout.GRAY, 200);

        assertThat(new ThresholdFilter(0.5).apply(dark, allocator).get(0, 0, 0)).isZero();
        assertThat(new ThresholdFilter(0.5).apply(light, allocator).get(0, 0, 0)).isEqualTo(255);
        assertThat(new SolarizeFilter(0.5).apply(dark, allocator).get(0, 0, 0)).isEqualTo(50);
        assertThat(new SolarizeFilter(0.5).apply(light, allocator).get(0, 0, 0)).isEqualTo(55);
    }

    @Test
    void posterizeSnapsToLevels() throws Exception {
        PixelBuffer source = PixelBuffer.filled(1, 1, ChannelLayout.RGB, 20, 100, 200);

        assertThat(pixel(new PosterizeFilter(1).apply(source, allocator))).containsExactly(0, 0, 255);
        assertThat(pixel(new PosterizeFilter(2).apply(source, allocator))).containsExactly(0, 128, 255);
    }

    @Test
    void neutralSettingsLeaveColoursAlone() throws Exception {
        PixelBuffer source = PixelBuffer.filled(2, 2, ChannelLayout.RGB, 12, 140, 230);

        assertThat(new SaturationFilter(1).apply(source, allocator).contentEquals(source)).isTrue();
        assertThat(new ContrastFilter(1).apply(source, allocator).contentEquals(source)).isTrue();
        assertThat(new ExposureFilter(0).apply(source, allocator).contentEquals(source)).isTrue();
        assertThat(new GammaFilter(1).apply(source, allocator).contentEquals(source)).isTrue();

        PixelBuffer rotated = new HueFilter(360).apply(source, allocator);
        for (int c = 0; c < 3; c++) {
            assertThat(rotated.get(0, 0, c)).isCloseTo(source.get(0, 0, c), within(1));
        }
    }

    @Test
    void zeroSaturationRemovesColour() throws Exception {
        PixelBuffer out = new SaturationFilter(0).apply(
                PixelBuffer.filled(1, 1, ChannelLayout.RGB, 200, 40, 90), allocator);

        int[] rgb = pixel(out);
        assertThat(rgb[0]).isEqualTo(rgb[1]).isEqualTo(rgb[2]);
    }

    @Test
    void vignetteDarkensCornersButNotTheCentre() throws Exception {
        PixelBuffer source = PixelBuffer.filled(21, 21, ChannelLayout.GRAY, 200);

        PixelBuffer out = new VignetteFilter(0.3, 0.75).apply(source, allocator);

        assertThat(out.get(10, 10, 0)).isEqualTo(200);
        assertThat(out.get(0, 0, 0)).isLessThan(100);
    }

    private static int[] pixel(PixelBuffer buffer) {
        int[] values = new int[buffer.getChannels()];
        for (int c = 0; c < values.length; c++) {
            values[c] = buffer.get(0, 0, c);
        }
        return values;
    }
}
