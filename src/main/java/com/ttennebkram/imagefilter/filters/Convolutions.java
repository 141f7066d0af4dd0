package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;

/**
 * Separable convolution shared by the linear blurs. All channels, alpha included,
 * are convolved.
 */
final class Convolutions {

    private Convolutions() {
    }

    /**
     * Convolve rows then columns with the same normalised kernel. The kernel
     * is centred on index {@code kernel.length / 2}.
     */
    static PixelBuffer separable(PixelBuffer source, double[] kernel, EdgeMode edgeMode,
                                 BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int half = kernel.length / 2;
        byte[] in = source.rawData();

        // horizontal pass
        double[] temp = new double[width * height * channels];
        int[] xIndex = new int[width + kernel.length];
        for (int i = 0; i < xIndex.length; i++) {
            xIndex[i] = edgeMode.resolve(i - half, width);
        }
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    double sum = 0;
                    for (int k = 0; k < kernel.length; k++) {
                        sum += kernel[k] * (in[(row + xIndex[x + k]) * channels + c] & 0xFF);
                    }
                    temp[(row + x) * channels + c] = sum;
                }
            }
        }

        // vertical pass
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        int[] yIndex = new int[height + kernel.length];
        for (int i = 0; i < yIndex.length; i++) {
            yIndex[i] = edgeMode.resolve(i - half, height);
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    double sum = 0;
                    for (int k = 0; k < kernel.length; k++) {
                        sum += kernel[k] * temp[(yIndex[y + k] * width + x) * channels + c];
                    }
                    out[(y * width + x) * channels + c] = (byte) FilterBase.clamp255((int) Math.floor(sum + 0.5));
                }
            }
        }
        return output;
    }

    static double[] normalize(double[] kernel) {
        double sum = 0;
        for (double k : kernel) {
            sum += k;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }
}
