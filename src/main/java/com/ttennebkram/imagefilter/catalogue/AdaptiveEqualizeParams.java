package com.ttennebkram.imagefilter.catalogue;

/**
 * Adaptive histogram equalization without contrast limiting.
 */
public final class AdaptiveEqualizeParams extends FilterParams {

    private final int gridSizeX;
    private final int gridSizeY;
    private final int bins;

    public AdaptiveEqualizeParams(int gridSizeX, int gridSizeY, int bins) {
        this.gridSizeX = gridSizeX;
        this.gridSizeY = gridSizeY;
        this.bins = bins;
    }

    public int getGridSizeX() {
        return gridSizeX;
    }

    public int getGridSizeY() {
        return gridSizeY;
    }

    public int getBins() {
        return bins;
    }

    /**
     * Same operation expressed as CLAHE with clipping disabled.
     */
    public ClaheParams toClahe() {
        return new ClaheParams(0, gridSizeX, gridSizeY, bins);
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{gridSizeX, gridSizeY, bins};
    }

    @Override
    public AdaptiveEqualizeParams withValues(double[] values) {
        checkArity(values, 3, AdaptiveEqualizeParams.class);
        return new AdaptiveEqualizeParams((int) Math.round(values[0]), (int) Math.round(values[1]),
                (int) Math.round(values[2]));
    }
}
