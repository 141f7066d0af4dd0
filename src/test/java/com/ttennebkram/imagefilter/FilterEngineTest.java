package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.backend.JavaFilterBackend;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.mask.MaskedFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FilterEngineTest {

    private TrackingBufferAllocator allocator;
    private FilterEngine engine;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty("executor.workerThreads", "1");
        allocator = new TrackingBufferAllocator();
        engine = new FilterEngine(EngineSettings.fromProperties(properties), allocator);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void exposesTheCatalogue() {
        assertThat(engine.catalogue()).hasSize(FilterKind.values().length);
        assertThat(engine.categories().values()).allSatisfy(kinds -> assertThat(kinds).isNotEmpty());
        assertThat(engine.getExecutor().getBackend()).isInstanceOf(JavaFilterBackend.class);
    }

    @Test
    void validatesThroughTheFacade() {
        FilterSpec clamped = engine.validate(FilterSpec.of(FilterKind.BRIGHTNESS, 7));

        assertThat(clamped.getParams().values()).containsExactly(1.0);
    }

    @Test
    void clearingTheCacheReleasesCachedResults() throws Exception {
        PixelBuffer source = PixelBuffer.filled(6, 4, ChannelLayout.RGB, 10, 20, 30);
        FilterChain chain = FilterChain.empty().then(FilterKind.INVERT).then(FilterKind.GRAYSCALE);

        PixelBuffer result = engine.apply(chain, source);

        assertThat(result.get(0, 0, 0)).isEqualTo(engine.apply(chain, source).get(0, 0, 0));
        assertThat(allocator.getActiveCount()).isEqualTo(2);
        assertThat(engine.clearCache()).isEqualTo(2);
        assertThat(allocator.getActiveCount()).isZero();
    }

    @Test
    void compositesAndPreviewsMasks() throws Exception {
        PixelBuffer original = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 0);
        PixelBuffer filtered = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 200);
        Mask left = Mask.rectangle(4, 4, 0, 0, 2, 4);

        PixelBuffer composite = engine.composite(original, filtered, left);
        PixelBuffer preview = engine.preview(original, left);

        assertThat(composite.get(0, 0, 0)).isEqualTo(200);
        assertThat(composite.get(3, 0, 0)).isZero();
        assertThat(preview.get(0, 0, 0)).as("half of the red tint's luma").isEqualTo(27);
        assertThat(preview.get(3, 0, 0)).isZero();
    }

    @Test
    void appliesMaskedChainsSynchronouslyAndInTheBackground() throws Exception {
        PixelBuffer source = PixelBuffer.filled(4, 4, ChannelLayout.GRAY, 100);
        List<MaskedFilter> layers = List.of(new MaskedFilter(Mask.full(4, 4),
                FilterChain.empty().then(FilterKind.INVERT)));

        PixelBuffer now = engine.applyMasks(source, layers);
        PixelBuffer later = engine.submitMasks(source, layers).get(5, TimeUnit.SECONDS);

        assertThat(now.get(2, 2, 0)).isEqualTo(155);
        assertThat(later.contentEquals(now)).isTrue();
    }

    @Test
    void submittedJobsDeliverResults() throws Exception {
        PixelBuffer source = PixelBuffer.filled(3, 3, ChannelLayout.GRAY, 40);

        PixelBuffer result = engine.submit(FilterChain.empty().then(FilterKind.INVERT), source, null)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.get(1, 1, 0)).isEqualTo(215);
    }
}
