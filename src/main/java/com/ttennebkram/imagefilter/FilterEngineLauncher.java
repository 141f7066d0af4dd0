package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.buffer.BufferImages;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.mask.Mask;
import com.ttennebkram.imagefilter.mask.MaskedFilter;
import com.ttennebkram.imagefilter.persistence.FilterChainSerializer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line: apply a saved chain to an image file.
 *
 * <pre>
 * FilterEngineLauncher &lt;chain.json&gt; &lt;input image&gt; &lt;output image&gt; [--mask mask.json]
 * </pre>
 */
public class FilterEngineLauncher {

    private static final Logger LOGGER = Logger.getLogger(FilterEngineLauncher.class.getName());

    static final String LOGGING_RESOURCE = "filter-engine-logging.properties";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: FilterEngineLauncher <chain.json> <input image> <output image> [--mask mask.json]");
            return EXIT_USAGE;
        }

        try (FilterEngine engine = new FilterEngine()) {
            FilterChain chain = FilterChainSerializer.load(arguments.chain);
            PixelBuffer source = BufferImages.read(arguments.input, engine.getAllocator());

            PixelBuffer result;
            if (arguments.mask != null) {
                Mask mask = FilterChainSerializer.loadMask(arguments.mask);
                result = engine.applyMasks(source, List.of(new MaskedFilter(mask, chain)));
            } else {
                result = engine.apply(chain, source);
            }
            BufferImages.write(result, arguments.output);
            LOGGER.info("Wrote " + arguments.output + " (" + chain.size() + " filter(s))");
            return EXIT_OK;
        } catch (IOException | FilterExecutionException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Filtering failed: " + e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static void configureLogging() {
        try (InputStream in = FilterEngineLauncher.class.getClassLoader().getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load " + LOGGING_RESOURCE + ": " + e.getMessage());
        }
    }

    static final class Arguments {
        final Path chain;
        final Path input;
        final Path output;
        final Path mask;

        private Arguments(Path chain, Path input, Path output, Path mask) {
            this.chain = chain;
            this.input = input;
            this.output = output;
            this.mask = mask;
        }

        static Arguments parse(String[] args) {
            Path mask = null;
            String[] positional = new String[3];
            int count = 0;
            for (int i = 0; i < args.length; i++) {
                if (args[i].equals("--mask")) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--mask needs a file");
                    }
                    mask = Paths.get(args[++i]);
                } else if (args[i].startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option " + args[i]);
                } else if (count < positional.length) {
                    positional[count++] = args[i];
                } else {
                    throw new IllegalArgumentException("Too many arguments");
                }
            }
            if (count < positional.length) {
                throw new IllegalArgumentException("Expected chain, input and output paths");
            }
            return new Arguments(Paths.get(positional[0]), Paths.get(positional[1]), Paths.get(positional[2]), mask);
        }
    }
}
