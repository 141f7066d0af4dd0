package com.ttennebkram.imagefilter.mask;

import java.awt.Rectangle;
import java.awt.geom.Area;

/**
 * Rasterises masks into antialiased coverage by supersampling each pixel on an
 * N x N grid of sample points placed at the centres of the sub-cells.
 */
public class MaskRasterizer {

    public static final int DEFAULT_SAMPLES_PER_AXIS = 4;
    public static final int MAX_SAMPLES_PER_AXIS = 16;

    private final int samplesPerAxis;

    public MaskRasterizer() {
        this(DEFAULT_SAMPLES_PER_AXIS);
    }

    public MaskRasterizer(int samplesPerAxis) {
        if (samplesPerAxis < 1 || samplesPerAxis > MAX_SAMPLES_PER_AXIS) {
            throw new IllegalArgumentException("samplesPerAxis must be in 1.." + MAX_SAMPLES_PER_AXIS + ": "
                    + samplesPerAxis);
        }
        this.samplesPerAxis = samplesPerAxis;
    }

    public int getSamplesPerAxis() {
        return samplesPerAxis;
    }

    public int getFullCoverage() {
        return samplesPerAxis * samplesPerAxis;
    }

    public CoverageMap coverage(Mask mask) {
        int width = mask.getWidth();
        int height = mask.getHeight();
        int full = getFullCoverage();
        int[] coverage = new int[width * height];

        Area region = mask.region();
        if (!region.isEmpty()) {
            Rectangle bounds = region.getBounds().intersection(new Rectangle(0, 0, width, height));
            double step = 1.0 / samplesPerAxis;
            for (int y = bounds.y; y < bounds.y + bounds.height; y++) {
                for (int x = bounds.x; x < bounds.x + bounds.width; x++) {
                    coverage[y * width + x] = pixelCoverage(region, x, y, step, full);
                }
            }
        }

        if (mask.isInverted()) {
            for (int i = 0; i < coverage.length; i++) {
                coverage[i] = full - coverage[i];
            }
        }
        return new CoverageMap(width, height, full, coverage);
    }

    private int pixelCoverage(Area region, int x, int y, double step, int full) {
        if (!region.intersects(x, y, 1, 1)) {
            return 0;
        }
        if (region.contains(x, y, 1, 1)) {
            return full;
        }
        int count = 0;
        for (int sy = 0; sy < samplesPerAxis; sy++) {
            double py = y + (sy + 0.5) * step;
            for (int sx = 0; sx < samplesPerAxis; sx++) {
                if (region.contains(x + (sx + 0.5) * step, py)) {
                    count++;
                }
            }
        }
        return count;
    }
}
