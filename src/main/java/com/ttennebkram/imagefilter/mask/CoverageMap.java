package com.ttennebkram.imagefilter.mask;

/**
 * Per-pixel mask coverage in whole sample units: 0 is uncovered,
 * {@link #getFullCoverage()} is fully covered.
 */
public final class CoverageMap {

    private final int width;
    private final int height;
    private final int fullCoverage;
    private final int[] coverage;

    CoverageMap(int width, int height, int fullCoverage, int[] coverage) {
        this.width = width;
        this.height = height;
        this.fullCoverage = fullCoverage;
        this.coverage = coverage;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFullCoverage() {
        return fullCoverage;
    }

    /**
     * Covered samples of pixel (x, y), 0..fullCoverage.
     */
    public int get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return coverage[y * width + x];
    }

    /**
     * Coverage of pixel (x, y) as a fraction in [0, 1].
     */
    public double fraction(int x, int y) {
        return (double) get(x, y) / fullCoverage;
    }

    /**
     * Coverage map with every value replaced by its complement.
     */
    public CoverageMap inverse() {
        int[] inverted = new int[coverage.length];
        for (int i = 0; i < coverage.length; i++) {
            inverted[i] = fullCoverage - coverage[i];
        }
        return new CoverageMap(width, height, fullCoverage, inverted);
    }

    int getAt(int index) {
        return coverage[index];
    }

    public boolean isEmpty() {
        for (int c : coverage) {
            if (c != 0) return false;
        }
        return true;
    }

    public boolean isFull() {
        for (int c : coverage) {
            if (c != fullCoverage) return false;
        }
        return true;
    }
}
