package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.buffer.BufferImages;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.buffer.TrackingBufferAllocator;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.persistence.FilterChainSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterEngineLauncherTest {

    @TempDir
    Path dir;

    private Path chain;
    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        chain = dir.resolve("chain.json");
        input = dir.resolve("in.png");
        output = dir.resolve("out/result.png");
        FilterChainSerializer.save(chain, FilterChain.empty().then(FilterKind.INVERT));
        BufferImages.write(PixelBuffer.filled(4, 2, ChannelLayout.RGB, 10, 20, 30), input);
    }

    @Test
    void appliesTheChainToTheImage() throws Exception {
        int exit = FilterEngineLauncher.run(new String[]{chain.toString(), input.toString(), output.toString()});

        assertThat(exit).isEqualTo(FilterEngineLauncher.EXIT_OK);
        PixelBuffer result = BufferImages.read(output, new TrackingBufferAllocator());
        assertThat(result.getWidth()).isEqualTo(4);
        assertThat(result.get(3, 1, 0)).isEqualTo(245);
        assertThat(result.get(3, 1, 2)).isEqualTo(225);
    }

    @Test
    void masksLimitWhereTheChainApplies() throws Exception {
        Path mask = dir.resolve("mask.json");
        FilterChainSerializer.saveMask(mask, Mask.rectangle(4, 2, 0, 0, 2, 2));

        int exit = FilterEngineLauncher.run(new String[]{
                chain.toString(), input.toString(), output.toString(), "--mask", mask.toString()});

        assertThat(exit).isEqualTo(FilterEngineLauncher.EXIT_OK);
        PixelBuffer result = BufferImages.read(output, new TrackingBufferAllocator());
        assertThat(result.get(0, 0, 0)).isEqualTo(245);
        assertThat(result.get(3, 0, 0)).isEqualTo(10);
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(FilterEngineLauncher.run(new String[]{chain.toString()})).isEqualTo(FilterEngineLauncher.EXIT_USAGE);
        assertThat(FilterEngineLauncher.run(new String[]{"a", "b", "c", "--verbose"}))
                .isEqualTo(FilterEngineLauncher.EXIT_USAGE);
        assertThat(FilterEngineLauncher.run(new String[]{"a", "b", "c", "--mask"}))
                .isEqualTo(FilterEngineLauncher.EXIT_USAGE);
    }

    @Test
    void unreadableChainExitsWithOne() throws Exception {
        Files.writeString(chain, "{ not json");

        assertThat(FilterEngineLauncher.run(new String[]{chain.toString(), input.toString(), output.toString()}))
                .isEqualTo(FilterEngineLauncher.EXIT_FAILED);
        assertThat(output).doesNotExist();
    }

    @Test
    void parsesOptionsAnywhere() {
        FilterEngineLauncher.Arguments arguments =
                FilterEngineLauncher.Arguments.parse(new String[]{"--mask", "m.json", "c.json", "in.png", "out.png"});

        assertThat(arguments.mask).hasFileName("m.json");
        assertThat(arguments.chain).hasFileName("c.json");
        assertThat(arguments.output).hasFileName("out.png");
        assertThatThrownBy(() -> FilterEngineLauncher.Arguments.parse(new String[]{"a", "b", "c", "d"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Too many arguments");
    }
}
