package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.backend.FilterBackend;
import com.ttennebkram.imagefilter.backend.FilterBackendException;
import com.ttennebkram.imagefilter.backend.JavaFilterBackend;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.cache.FilterCache;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FilterExecutorTest {

    private static final FilterChain THREE_STAGES = FilterChain.empty()
            .then(FilterKind.BRIGHTNESS, 0.1)
            .then(FilterKind.GAUSSIAN_BLUR, 2, 1)
            .then(FilterKind.INVERT);

    private TrackingBufferAllocator allocator;
    private FilterExecutor executor;

    @BeforeEach
    void setUp() {
        allocator = new TrackingBufferAllocator();
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    @Test
    void emptyChainReturnsTheSourceItself() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        PixelBuffer source = gradient(ChannelLayout.RGB);

        assertThat(executor.apply(FilterChain.empty(), source)).isSameAs(source);
        assertThat(allocator.getTotalAllocated()).isZero();
    }

    @Test
    void exposureOfHalfAStopOnGray100Yields141() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);

        PixelBuffer result = executor.apply(FilterChain.empty().then(FilterKind.EXPOSURE, 0.5), source);

        assertThat(result.contentEquals(PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 141))).isTrue();
    }

    @Test
    void chainOrderMatters() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        PixelBuffer source = PixelBuffer.filled(2, 2, ChannelLayout.GRAY, 100);

        PixelBuffer brightThenContrast = executor.apply(FilterChain.empty()
                .then(FilterKind.BRIGHTNESS, 0.2)
                .then(FilterKind.CONTRAST, 1.5), source);
        PixelBuffer contrastThenBright = executor.apply(FilterChain.empty()
                .then(FilterKind.CONTRAST, 1.5)
                .then(FilterKind.BRIGHTNESS, 0.2), source);

        assertThat(brightThenContrast.get(0, 0, 0)).isEqualTo(163);
        assertThat(contrastThenBright.get(0, 0, 0)).isEqualTo(137);
    }

    @Test
    void releasesEveryIntermediate() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        PixelBuffer source = gradient(ChannelLayout.RGBA);

        PixelBuffer result = executor.apply(THREE_STAGES, source);

        assertThat(allocator.getActiveCount()).isEqualTo(1);
        assertThat(allocator.isTracked(result)).isTrue();
        assertThat(allocator.bytesInUse()).isEqualTo(result.byteSize());
    }

    @Test
    void resultIsTheSameWithAndWithoutCache() throws Exception {
        PixelBuffer source = gradient(ChannelLayout.RGB);
        PixelBuffer uncached;
        try (FilterExecutor plain = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1)) {
            uncached = plain.apply(THREE_STAGES, source);
        }

        FilterBackend backend = spy(new JavaFilterBackend(allocator));
        executor = new FilterExecutor(backend, new FilterCache(16, 1 << 20), allocator, 0, 1);
        PixelBuffer first = executor.apply(THREE_STAGES, source);
        PixelBuffer second = executor.apply(THREE_STAGES, source);

        assertThat(first.contentEquals(uncached)).isTrue();
        assertThat(second.contentEquals(uncached)).isTrue();
        verify(backend, times(3)).transform(any(), any(), any());
        assertThat(executor.getCache().getHitCount()).isEqualTo(3);
    }

    @Test
    void editingAResultDoesNotCorruptTheCache() throws Exception {
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);
        FilterChain chain = FilterChain.empty().then(FilterKind.INVERT);
        FilterCache cache = new FilterCache(16, 1 << 20);
        executor = new FilterExecutor(new JavaFilterBackend(allocator), cache, allocator, 0, 1);

        PixelBuffer first = executor.apply(chain, source);
        first.set(0, 0, 0, 0);
        PixelBuffer second = executor.apply(chain, source);

        assertThat(cache.isResident(first)).isFalse();
        assertThat(cache.getHitCount()).isEqualTo(1);
        assertThat(second.get(0, 0, 0)).isEqualTo(155);
        assertThat(second.contentEquals(PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 155))).isTrue();
    }

    @Test
    void evictionDoesNotChangeResults() throws Exception {
        PixelBuffer source = gradient(ChannelLayout.RGB);
        FilterCache tinyCache = new FilterCache(1, 1 << 20);
        executor = new FilterExecutor(new JavaFilterBackend(allocator), tinyCache, allocator, 0, 1);

        PixelBuffer first = executor.apply(THREE_STAGES, source).copy();
        tinyCache.invalidateAll();
        PixelBuffer afterFlush = executor.apply(THREE_STAGES, source);
        executor.apply(FilterChain.empty().then(FilterKind.SEPIA, 0.5), source);
        PixelBuffer afterEviction = executor.apply(THREE_STAGES, source);

        assertThat(tinyCache.getEvictionCount()).isPositive();
        assertThat(afterFlush.contentEquals(first)).isTrue();
        assertThat(afterEviction.contentEquals(first)).isTrue();
    }

    @Test
    void reportsProgressAfterEveryStage() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        List<String> events = new ArrayList<>();

        executor.apply(THREE_STAGES, gradient(ChannelLayout.GRAY),
                (stage, total, kind) -> events.add(stage + "/" + total + " " + kind), new CancellationSignal());

        assertThat(events).containsExactly("1/3 BRIGHTNESS", "2/3 GAUSSIAN_BLUR", "3/3 INVERT");
    }

    @Test
    void cancelledSignalStopsBeforeTheFirstStage() throws Exception {
        FilterBackend backend = mock(FilterBackend.class);
        executor = new FilterExecutor(backend, null, allocator, 0, 1);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> executor.apply(THREE_STAGES, gradient(ChannelLayout.RGB),
                ChainProgressListener.NONE, signal))
                .isInstanceOf(ChainCancelledException.class);
        verify(backend, times(0)).transform(any(), any(), any());
    }

    @Test
    void cancellingASubmittedJobStopsAtTheNextStage() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        FilterBackend java = new JavaFilterBackend(allocator);
        FilterBackend backend = mock(FilterBackend.class);
        when(backend.transform(any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            proceed.await(5, TimeUnit.SECONDS);
            return java.transform(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2));
        });
        executor = new FilterExecutor(backend, null, allocator, 0, 1);

        FilterJob job = executor.submit(THREE_STAGES, gradient(ChannelLayout.RGB), null);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        job.cancel(false);
        proceed.countDown();
        // single worker: this runs only once the cancelled chain has unwound
        executor.submitTask(() -> null).get(5, TimeUnit.SECONDS);

        assertThat(job.isCancelled()).isTrue();
        assertThatThrownBy(job::get).isInstanceOf(CancellationException.class);
        verify(backend, times(1)).transform(any(), any(), any());
        assertThat(job.getCompletedStages()).isEqualTo(1);
        assertThat(allocator.bytesInUse()).isZero();
    }

    @Test
    void submittedJobCompletesWithTheChainResult() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 2);
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);

        FilterJob job = executor.submit(FilterChain.empty().then(FilterKind.EXPOSURE, 0.5), source,
                ChainProgressListener.NONE);

        assertThat(job.get(5, TimeUnit.SECONDS).get(3, 3, 0)).isEqualTo(141);
        assertThat(job.getCompletedStages()).isEqualTo(1);
        assertThat(job.getTotalStages()).isEqualTo(1);
    }

    @Test
    void failingStageAbortsTheChainWithItsPosition() throws Exception {
        FilterBackend java = new JavaFilterBackend(allocator);
        FilterBackend backend = mock(FilterBackend.class);
        when(backend.transform(eq(FilterKind.BRIGHTNESS), any(), any())).thenAnswer(invocation ->
                java.transform(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2)));
        FilterBackendException failure = new FilterBackendException("boom", FilterKind.INVERT, null);
        when(backend.transform(eq(FilterKind.INVERT), any(), any())).thenThrow(failure);
        executor = new FilterExecutor(backend, null, allocator, 0, 1);

        FilterChain chain = FilterChain.empty().then(FilterKind.BRIGHTNESS, 0.1).then(FilterKind.INVERT);
        assertThatThrownBy(() -> executor.apply(chain, gradient(ChannelLayout.RGB)))
                .isInstanceOfSatisfying(ChainExecutionException.class, e -> {
                    assertThat(e.getStageIndex()).isEqualTo(1);
                    assertThat(e.getStageCount()).isEqualTo(2);
                    assertThat(e.getKind()).isEqualTo(FilterKind.INVERT);
                    assertThat(e.getCause()).isSameAs(failure);
                });
        assertThat(allocator.bytesInUse()).isZero();
    }

    @Test
    void uncheckedBackendFailuresAreWrappedToo() throws Exception {
        FilterBackend backend = mock(FilterBackend.class);
        when(backend.transform(any(), any(), any())).thenThrow(new IllegalStateException("broken"));
        executor = new FilterExecutor(backend, null, allocator, 0, 1);

        assertThatThrownBy(() -> executor.apply(THREE_STAGES, gradient(ChannelLayout.RGB)))
                .isInstanceOf(ChainExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsChainsThatWouldExceedTheMemoryCeiling() throws Exception {
        PixelBuffer source = gradient(ChannelLayout.RGBA);
        long ceiling = source.byteSize() * 2;
        FilterBackend backend = mock(FilterBackend.class);
        executor = new FilterExecutor(backend, null, allocator, ceiling, 1);

        assertThat(FilterExecutor.estimateBytes(THREE_STAGES, source)).isEqualTo(source.byteSize() * 3);
        assertThat(FilterExecutor.estimateBytes(FilterChain.empty().then(FilterKind.INVERT), source))
                .isEqualTo(source.byteSize() * 2);
        assertThatThrownBy(() -> executor.apply(THREE_STAGES, source))
                .isInstanceOfSatisfying(MemoryBudgetExceededException.class, e -> {
                    assertThat(e.getCeilingBytes()).isEqualTo(ceiling);
                    assertThat(e.getEstimatedBytes()).isEqualTo(source.byteSize() * 3);
                });
        verify(backend, times(0)).transform(any(), any(), any());
    }

    @Test
    void invalidPayloadsAreClampedBeforeDispatch() throws Exception {
        executor = new FilterExecutor(new JavaFilterBackend(allocator), null, allocator, 0, 1);
        PixelBuffer source = PixelBuffer.filled(2, 2, ChannelLayout.GRAY, 100);

        PixelBuffer clamped = executor.apply(FilterChain.empty().then(FilterKind.BRIGHTNESS, 7), source);

        assertThat(clamped.get(0, 0, 0)).isEqualTo(255);
    }

    static PixelBuffer gradient(ChannelLayout layout) {
        int width = 9;
        int height = 7;
        PixelBuffer buffer = PixelBuffer.filled(width, height, layout, new int[layout.getChannels()]);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < layout.getChannels(); c++) {
                    buffer.set(x, y, c, (x * 29 + y * 17 + c * 53) % 256);
                }
            }
        }
        return buffer;
    }
}
