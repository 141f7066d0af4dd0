package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.PinchParams;

/**
 * Pinch and whirl distortion inside a circle. Each output pixel is resampled
 * bilinearly from its inverse-transformed source position.
 */
public class PinchFilter extends FilterBase {

    private final double angle;
    private final double centerX;
    private final double centerY;
    private final double radius;
    private final double amount;

    public PinchFilter(PinchParams params) {
        this.angle = Math.toRadians(params.getAngle());
        this.centerX = params.getCenterX();
        this.centerY = params.getCenterY();
        this.radius = params.getRadius();
        this.amount = params.getAmount();
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        double cx = centerX * width;
        double cy = centerY * height;
        double r = radius * Math.min(width, height) / 2.0;
        double r2 = r * r;

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        double[] src = new double[2];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                transformInverse(x, y, cx, cy, r2, src);
                int base = (y * width + x) * channels;
                for (int c = 0; c < channels; c++) {
                    out[base + c] = (byte) clamp255((int) Math.floor(sampleBilinear(source, src[0], src[1], c) + 0.5));
                }
            }
        }
        return output;
    }

    private void transformInverse(int x, int y, double cx, double cy, double r2, double[] out) {
        double dx = x - cx;
        double dy = y - cy;
        double distance = dx * dx + dy * dy;

        if (distance > r2 || distance == 0) {
            out[0] = x;
            out[1] = y;
            return;
        }

        double d = Math.sqrt(distance / r2);
        double t = Math.pow(Math.sin(Math.PI * 0.5 * d), -amount);
        dx *= t;
        dy *= t;

        double e = 1 - d;
        double a = angle * e * e;
        double s = Math.sin(a);
        double c = Math.cos(a);
        out[0] = cx + c * dx - s * dy;
        out[1] = cy + s * dx + c * dy;
    }
}
