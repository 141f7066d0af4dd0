package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Simulates CMY halftone printing: each colour channel becomes a screen of dots
 * on a grid rotated by that channel's screen angle, the dot size following the
 * channel's darkness. Gray images use the cyan screen. Alpha passes through.
 */
public class ColorHalftoneFilter extends FilterBase {

    private static final int[] MX = {0, -1, 1, 0, 0};
    private static final int[] MY = {0, 0, 0, -1, 1};

    private final double dotRadius;
    private final double[] angles;

    public ColorHalftoneFilter(double dotRadius, double cyanAngle, double magentaAngle, double yellowAngle) {
        this.dotRadius = dotRadius;
        this.angles = new double[]{
                Math.toRadians(cyanAngle), Math.toRadians(magentaAngle), Math.toRadians(yellowAngle)
        };
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();
        double gridSize = 2 * dotRadius * 1.414;
        double halfGridSize = gridSize / 2;

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        byte[] in = source.rawData();

        for (int c = 0; c < colors; c++) {
            double cos = Math.cos(angles[c]);
            double sin = Math.sin(angles[c]);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    // transform into screen space and snap to the cell centre
                    double tx = x * cos + y * sin;
                    double ty = -x * sin + y * cos;
                    tx = tx - mod(tx - halfGridSize, gridSize) + halfGridSize;
                    ty = ty - mod(ty - halfGridSize, gridSize) + halfGridSize;

                    double f = 1;
                    for (int i = 0; i < 5; i++) {
                        // neighbouring cells can overlap this pixel too
                        double ttx = tx + MX[i] * gridSize;
                        double tty = ty + MY[i] * gridSize;
                        double ntx = ttx * cos - tty * sin;
                        double nty = ttx * sin + tty * cos;
                        int nx = (int) clamp((int) ntx, 0, width - 1);
                        int ny = (int) clamp((int) nty, 0, height - 1);
                        double l = (in[(ny * width + nx) * channels + c] & 0xFF) / 255.0;
                        l = 1 - l * l;
                        l *= halfGridSize * 1.414;
                        double dx = x - ntx;
                        double dy = y - nty;
                        double radius = Math.sqrt(dx * dx + dy * dy);
                        double f2 = 1 - smoothstep(radius, radius + 1, l);
                        f = Math.min(f, f2);
                    }
                    out[(y * width + x) * channels + c] = (byte) (int) (255 * f);
                }
            }
        }
        if (source.getLayout().hasAlpha()) {
            for (int i = channels - 1; i < in.length; i += channels) {
                out[i] = in[i];
            }
        }
        return output;
    }

    private static double mod(double a, double b) {
        return a - b * Math.floor(a / b);
    }
}
