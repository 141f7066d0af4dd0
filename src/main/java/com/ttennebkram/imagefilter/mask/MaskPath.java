package com.ttennebkram.imagefilter.mask;

import java.awt.BasicStroke;
import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.util.ArrayList;
import java.util.List;

/**
 * One path of a mask: either a filled outline (stroke width 0) or a brush stroke
 * of the given width. Erase paths remove coverage instead of adding it.
 */
public final class MaskPath {

    private final List<MaskAnchor> anchors;
    private final boolean closed;
    private final double strokeWidth;
    private final boolean erase;

    public MaskPath(List<MaskAnchor> anchors, boolean closed, double strokeWidth, boolean erase) {
        if (strokeWidth < 0 || Double.isNaN(strokeWidth)) {
            throw new IllegalArgumentException("strokeWidth must not be negative: " + strokeWidth);
        }
        this.anchors = List.copyOf(anchors);
        this.closed = closed;
        this.strokeWidth = strokeWidth;
        this.erase = erase;
    }

    /**
     * Closed filled polygon through the given points.
     */
    public static MaskPath polygon(double... xy) {
        return new MaskPath(anchors(xy), true, 0, false);
    }

    /**
     * Brush stroke through the given points.
     */
    public static MaskPath stroke(double width, double... xy) {
        return new MaskPath(anchors(xy), false, width, false);
    }

    public static MaskPath rectangle(double x, double y, double width, double height) {
        return polygon(x, y, x + width, y, x + width, y + height, x, y + height);
    }

    private static List<MaskAnchor> anchors(double... xy) {
        if (xy.length % 2 != 0) {
            throw new IllegalArgumentException("Coordinates must come in x, y pairs");
        }
        List<MaskAnchor> list = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            list.add(new MaskAnchor(xy[i], xy[i + 1]));
        }
        return list;
    }

    public List<MaskAnchor> getAnchors() {
        return anchors;
    }

    public boolean isClosed() {
        return closed;
    }

    public double getStrokeWidth() {
        return strokeWidth;
    }

    public boolean isStroke() {
        return strokeWidth > 0;
    }

    public boolean isErase() {
        return erase;
    }

    public MaskPath asEraser() {
        return new MaskPath(anchors, closed, strokeWidth, true);
    }

    /**
     * Outline through the anchors, or null when there are no anchors.
     */
    Path2D outline(int windingRule) {
        if (anchors.isEmpty()) {
            return null;
        }
        Path2D.Double path = new Path2D.Double(windingRule);
        MaskAnchor first = anchors.get(0);
        path.moveTo(first.getX(), first.getY());
        for (int i = 1; i < anchors.size(); i++) {
            path.lineTo(anchors.get(i).getX(), anchors.get(i).getY());
        }
        if (closed || !isStroke()) {
            path.closePath();
        }
        return path;
    }

    /**
     * Area this path covers, or null if it covers nothing.
     */
    Shape shape(int windingRule) {
        if (anchors.isEmpty()) {
            return null;
        }
        if (!isStroke()) {
            return anchors.size() < 3 ? null : outline(windingRule);
        }
        if (anchors.size() == 1) {
            // a dab of the brush
            MaskAnchor a = anchors.get(0);
            double r = strokeWidth / 2;
            return new Ellipse2D.Double(a.getX() - r, a.getY() - r, strokeWidth, strokeWidth);
        }
        BasicStroke brush = new BasicStroke((float) strokeWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);
        return brush.createStrokedShape(outline(windingRule));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaskPath other)) return false;
        return closed == other.closed && erase == other.erase
                && Double.compare(strokeWidth, other.strokeWidth) == 0 && anchors.equals(other.anchors);
    }

    @Override
    public int hashCode() {
        int result = anchors.hashCode();
        result = 31 * result + (closed ? 1 : 0);
        result = 31 * result + Double.hashCode(strokeWidth);
        return 31 * result + (erase ? 1 : 0);
    }

    @Override
    public String toString() {
        return (erase ? "Erase" : "") + (isStroke() ? "Stroke[" + strokeWidth + "]" : "Fill")
                + anchors + (closed ? " closed" : "");
    }
}
