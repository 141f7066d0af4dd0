package com.ttennebkram.imagefilter.buffer;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingBufferAllocatorTest {

    @Test
    void tracksBytesUntilRelease() throws Exception {
        TrackingBufferAllocator allocator = new TrackingBufferAllocator();

        PixelBuffer a = allocator.allocate(10, 10, ChannelLayout.RGBA);
        PixelBuffer b = allocator.allocateLike(a);
        assertThat(allocator.bytesInUse()).isEqualTo(800);
        assertThat(allocator.getActiveCount()).isEqualTo(2);

        allocator.release(a);
        allocator.release(a);
        allocator.release(PixelBuffer.filled(1, 1, ChannelLayout.GRAY, 0));
        assertThat(allocator.bytesInUse()).isEqualTo(400);
        assertThat(allocator.isTracked(b)).isTrue();
        assertThat(allocator.getTotalAllocated()).isEqualTo(2);
        assertThat(allocator.getTotalReleased()).isEqualTo(1);
    }

    @Test
    void allocatedBuffersAreZeroFilled() throws Exception {
        PixelBuffer buffer = new TrackingBufferAllocator().allocate(3, 2, ChannelLayout.RGB);

        assertThat(buffer.rawData()).containsOnly((byte) 0);
        assertThat(buffer.byteSize()).isEqualTo(18);
    }

    @Test
    void enforcesTheConfiguredLimit() throws Exception {
        TrackingBufferAllocator allocator = new TrackingBufferAllocator(1000);
        allocator.allocate(20, 20, ChannelLayout.GRAY);

        assertThatThrownBy(() -> allocator.allocate(20, 20, ChannelLayout.RGB))
                .isInstanceOfSatisfying(AllocationFailureException.class, e -> {
                    assertThat(e.getRequestedBytes()).isEqualTo(1200);
                    assertThat(e.getAvailableBytes()).isEqualTo(600);
                    assertThat(e.getSuggestedScale()).isBetween(0.0, 1.0);
                });
        assertThat(allocator.bytesInUse()).isEqualTo(400);
    }

    @Test
    void reportsLeaksWithTheirAllocationSite() throws Exception {
        TrackingBufferAllocator allocator = new TrackingBufferAllocator();
        allocator.setCaptureLocations(true);
        allocator.allocate(4, 4, ChannelLayout.GRAY);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        allocator.dumpLeaks(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertThat(bytes.toString(StandardCharsets.UTF_8))
                .contains("1 ACTIVE BUFFERS")
                .contains("TrackingBufferAllocatorTest.java");
    }
}
