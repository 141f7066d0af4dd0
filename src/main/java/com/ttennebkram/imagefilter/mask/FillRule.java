package com.ttennebkram.imagefilter.mask;

import java.awt.geom.Path2D;

/**
 * How overlapping filled paths decide what is inside.
 */
public enum FillRule {
    NON_ZERO(Path2D.WIND_NON_ZERO),
    EVEN_ODD(Path2D.WIND_EVEN_ODD);

    private final int windingRule;

    FillRule(int windingRule) {
        this.windingRule = windingRule;
    }

    public int getWindingRule() {
        return windingRule;
    }
}
