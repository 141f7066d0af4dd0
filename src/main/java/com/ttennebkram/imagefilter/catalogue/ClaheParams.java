package com.ttennebkram.imagefilter.catalogue;

/**
 * Contrast limited adaptive histogram equalization. A clip limit of 0
 * disables clipping, which is how plain adaptive equalization is expressed.
 */
public final class ClaheParams extends FilterParams {

    private final double clipLimit;
    private final int gridSizeX;
    private final int gridSizeY;
    private final int bins;

    public ClaheParams(double clipLimit, int gridSizeX, int gridSizeY, int bins) {
        this.clipLimit = clipLimit;
        this.gridSizeX = gridSizeX;
        this.gridSizeY = gridSizeY;
        this.bins = bins;
    }

    public double getClipLimit() {
        return clipLimit;
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

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{clipLimit, gridSizeX, gridSizeY, bins};
    }

    @Override
    public ClaheParams withValues(double[] values) {
        checkArity(values, 4, ClaheParams.class);
        return new ClaheParams(values[0], (int) Math.round(values[1]), (int) Math.round(values[2]),
                (int) Math.round(values[3]));
    }
}
