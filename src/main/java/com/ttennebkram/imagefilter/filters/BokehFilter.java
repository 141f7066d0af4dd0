package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lens blur with a regular polygon aperture of {@code blades} sides.
 */
public class BokehFilter extends FilterBase {

    private final int size;
    private final int blades;

    public BokehFilter(int size, int blades) {
        this.size = Math.max(1, size);
        this.blades = Math.max(3, blades);
    }

    /**
     * Offsets (dx, dy) inside the aperture polygon.
     */
    List<int[]> aperture() {
        List<int[]> offsets = new ArrayList<>();
        double sector = 2 * Math.PI / blades;
        double apothem = size * Math.cos(Math.PI / blades);
        for (int dy = -size; dy <= size; dy++) {
            for (int dx = -size; dx <= size; dx++) {
                double distance = Math.sqrt(dx * dx + dy * dy);
                if (distance == 0) {
                    offsets.add(new int[]{0, 0});
                    continue;
                }
                double theta = Math.atan2(dy, dx) - Math.PI / 2;
                double local = theta - sector * Math.floor(theta / sector) - sector / 2;
                double edge = apothem / Math.cos(local);
                if (distance <= edge + 1e-9) {
                    offsets.add(new int[]{dx, dy});
                }
            }
        }
        return offsets;
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        List<int[]> offsets = aperture();
        byte[] in = source.rawData();
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        long[] sums = new long[channels];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Arrays.fill(sums, 0);
                for (int[] offset : offsets) {
                    int sx = EdgeMode.REFLECT_101.resolve(x + offset[0], width);
                    int sy = EdgeMode.REFLECT_101.resolve(y + offset[1], height);
                    int base = (sy * width + sx) * channels;
                    for (int c = 0; c < channels; c++) {
                        sums[c] += in[base + c] & 0xFF;
                    }
                }
                int n = offsets.size();
                int base = (y * width + x) * channels;
                for (int c = 0; c < channels; c++) {
                    out[base + c] = (byte) ((sums[c] * 2 + n) / (2L * n));
                }
            }
        }
        return output;
    }
}
