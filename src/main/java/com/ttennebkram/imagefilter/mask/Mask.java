package com.ttennebkram.imagefilter.mask;

import java.awt.Shape;
import java.awt.geom.Area;
import java.awt.geom.Path2D;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Vector mask over a canvas: an ordered list of paths combined into a region.
 *
 * Paths are applied in order. Consecutive filled paths are combined under the
 * mask's fill rule, brush strokes are added, and erase paths cut away whatever
 * was built before them. An inverted mask covers exactly what the region does not.
 */
public final class Mask {

    /** Default preview tint, opaque red */
    public static final int DEFAULT_PREVIEW_COLOR = 0xFF0000;

    private final int width;
    private final int height;
    private final List<MaskPath> paths;
    private final FillRule fillRule;
    private final boolean inverted;
    private final int previewColor;

    private Mask(Builder builder) {
        if (builder.width <= 0 || builder.height <= 0) {
            throw new IllegalArgumentException("Mask canvas must be positive: " + builder.width + "x" + builder.height);
        }
        this.width = builder.width;
        this.height = builder.height;
        this.paths = List.copyOf(builder.paths);
        this.fillRule = builder.fillRule;
        this.inverted = builder.inverted;
        this.previewColor = builder.previewColor & 0xFFFFFF;
    }

    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }

    /**
     * Mask covering nothing.
     */
    public static Mask empty(int width, int height) {
        return builder(width, height).build();
    }

    /**
     * Mask covering the whole canvas.
     */
    public static Mask full(int width, int height) {
        return builder(width, height).add(MaskPath.rectangle(0, 0, width, height)).build();
    }

    public static Mask rectangle(int width, int height, double x, double y, double w, double h) {
        return builder(width, height).add(MaskPath.rectangle(x, y, w, h)).build();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<MaskPath> getPaths() {
        return paths;
    }

    public FillRule getFillRule() {
        return fillRule;
    }

    public boolean isInverted() {
        return inverted;
    }

    public int getPreviewColor() {
        return previewColor;
    }

    /**
     * Same mask with inversion flipped.
     */
    public Mask inverse() {
        return toBuilder().inverted(!inverted).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(width, height);
        builder.paths.addAll(paths);
        builder.fillRule = fillRule;
        builder.inverted = inverted;
        builder.previewColor = previewColor;
        return builder;
    }

    /**
     * The covered region before inversion.
     */
    public Area region() {
        Area area = new Area();
        Path2D pendingFill = null;
        for (MaskPath path : paths) {
            if (!path.isStroke() && !path.isErase()) {
                Shape shape = path.shape(fillRule.getWindingRule());
                if (shape != null) {
                    if (pendingFill == null) {
                        pendingFill = new Path2D.Double(fillRule.getWindingRule());
                    }
                    pendingFill.append(shape, false);
                }
                continue;
            }
            if (pendingFill != null) {
                area.add(new Area(pendingFill));
                pendingFill = null;
            }
            Shape shape = path.shape(fillRule.getWindingRule());
            if (shape == null) {
                continue;
            }
            if (path.isErase()) {
                area.subtract(new Area(shape));
            } else {
                area.add(new Area(shape));
            }
        }
        if (pendingFill != null) {
            area.add(new Area(pendingFill));
        }
        return area;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mask other)) return false;
        return width == other.width && height == other.height && inverted == other.inverted
                && previewColor == other.previewColor && fillRule == other.fillRule && paths.equals(other.paths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, paths, fillRule, inverted, previewColor);
    }

    @Override
    public String toString() {
        return "Mask[" + width + "x" + height + ", " + paths.size() + " path(s), " + fillRule
                + (inverted ? ", inverted" : "") + "]";
    }

    public static final class Builder {
        private final int width;
        private final int height;
        private final List<MaskPath> paths = new ArrayList<>();
        private FillRule fillRule = FillRule.NON_ZERO;
        private boolean inverted;
        private int previewColor = DEFAULT_PREVIEW_COLOR;

        private Builder(int width, int height) {
            this.width = width;
            this.height = height;
        }

        public Builder add(MaskPath path) {
            paths.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder fillRule(FillRule fillRule) {
            this.fillRule = Objects.requireNonNull(fillRule, "fillRule");
            return this;
        }

        public Builder inverted(boolean inverted) {
            this.inverted = inverted;
            return this;
        }

        public Builder previewColor(int rgb) {
            this.previewColor = rgb;
            return this;
        }

        public Mask build() {
            return new Mask(this);
        }
    }
}
