package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaFilterBackendTest {

    static Stream<Arguments> everyKindOnEveryLayout() {
        return Arrays.stream(FilterKind.values())
                .flatMap(kind -> Arrays.stream(ChannelLayout.values()).map(layout -> Arguments.of(kind, layout)));
    }

    @ParameterizedTest(name = "{0} on {1}")
    @MethodSource("everyKindOnEveryLayout")
    void producesAFreshBufferOfTheSameShape(FilterKind kind, ChannelLayout layout) throws Exception {
        TrackingBufferAllocator allocator = new TrackingBufferAllocator();
        JavaFilterBackend backend = new JavaFilterBackend(allocator);
        PixelBuffer source = pattern(layout);
        PixelBuffer before = source.copy();

        PixelBuffer out = backend.transform(kind, kind.getDefaultParams(), source);

        assertThat(out).isNotSameAs(source);
        assertThat(out.sameDimensions(source)).isTrue();
        assertThat(source.contentEquals(before)).as("source untouched").isTrue();
        assertThat(allocator.getActiveCount()).as("only the result stays allocated").isEqualTo(1);
    }

    @Test
    void allocationFailuresPassThroughUnwrapped() {
        JavaFilterBackend backend = new JavaFilterBackend(new TrackingBufferAllocator(10));

        assertThatThrownBy(() -> backend.transform(FilterKind.INVERT, FilterKind.INVERT.getDefaultParams(),
                pattern(ChannelLayout.RGB)))
                .isExactlyInstanceOf(AllocationFailureException.class);
    }

    @Test
    void supportsEveryKind() {
        JavaFilterBackend backend = new JavaFilterBackend(new TrackingBufferAllocator());

        assertThat(FilterKind.values()).allMatch(backend::supports);
        assertThat(backend.getName()).isEqualTo("java");
    }

    private static PixelBuffer pattern(ChannelLayout layout) {
        PixelBuffer buffer = PixelBuffer.filled(12, 10, layout, new int[layout.getChannels()]);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 12; x++) {
                for (int c = 0; c < layout.getChannels(); c++) {
                    buffer.set(x, y, c, c == 3 ? 100 + x : (x * 31 + y * 13 + c * 70) % 256);
                }
            }
        }
        return buffer;
    }
}
