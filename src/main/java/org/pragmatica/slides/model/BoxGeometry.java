package org.pragmatica.slides.model;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * A box's rectangle in logical canvas coordinates plus its clockwise rotation in degrees.
 * The rotation pivots about the rectangle's center.
 */
public record BoxGeometry(double left, double top, double width, double height, double angle) {

    public static final BoxGeometry EMPTY = new BoxGeometry(0, 0, 0, 0, 0);

    public static BoxGeometry of(double left, double top, double width, double height) {
        return new BoxGeometry(left, top, width, height, 0);
    }

    public double right() {
        return left + width;
    }

    public double bottom() {
        return top + height;
    }

    public Point2D center() {
        return new Point2D.Double(left + width / 2, top + height / 2);
    }

    public BoxGeometry withLeft(double value) {
        return new BoxGeometry(value, top, width, height, angle);
    }

    public BoxGeometry withTop(double value) {
        return new BoxGeometry(left, value, width, height, angle);
    }

    public BoxGeometry withWidth(double value) {
        return new BoxGeometry(left, top, value, height, angle);
    }

    public BoxGeometry withHeight(double value) {
        return new BoxGeometry(left, top, width, value, angle);
    }

    public BoxGeometry withAngle(double value) {
        return new BoxGeometry(left, top, width, height, value);
    }

    public BoxGeometry translated(double dx, double dy) {
        return new BoxGeometry(left + dx, top + dy, width, height, angle);
    }

    /**
     * Same rectangle with non-negative extents; a negative width or height moves the origin instead.
     */
    public BoxGeometry normalized() {
        double x = width < 0 ? left + width : left;
        double y = height < 0 ? top + height : top;
        return new BoxGeometry(x, y, Math.abs(width), Math.abs(height), angle);
    }

    /**
     * Rotation by {@link #angle()} about the rectangle's center.
     */
    public AffineTransform transform() {
        return transform(center());
    }

    /**
     * Rotation by {@link #angle()} about an arbitrary pivot.
     */
    public AffineTransform transform(Point2D pivot) {
        var transform = new AffineTransform();
        transform.translate(pivot.getX(), pivot.getY());
        transform.rotate(Math.toRadians(angle));
        transform.translate(-pivot.getX(), -pivot.getY());
        return transform;
    }

    /**
     * Inverse of {@link #transform(Point2D)}: rotation by {@code -angle} about the same pivot.
     */
    public AffineTransform inverseTransform(Point2D pivot) {
        return withAngle(-angle).transform(pivot);
    }

    /**
     * Map a world point into the box's unrotated frame.
     */
    public Point2D toLocal(Point2D point) {
        return inverseTransform(center()).transform(point, null);
    }

    /**
     * Classify a point against the rotated rectangle, treating everything within {@code margin}
     * of an edge as that edge. Being close to two adjacent edges yields the corner between them.
     */
    public PointPosition classifyPoint(Point2D point, double margin) {
        var normalized = normalized();
        var local = normalized.toLocal(point);
        double x = local.getX();
        double y = local.getY();

        if (x < normalized.left - margin || x > normalized.right() + margin
            || y < normalized.top - margin || y > normalized.bottom() + margin) {
            return PointPosition.NOT_IN_BOX;
        }

        boolean nearLeft = Math.abs(x - normalized.left) <= margin;
        boolean nearRight = !nearLeft && Math.abs(x - normalized.right()) <= margin;
        boolean nearTop = Math.abs(y - normalized.top) <= margin;
        boolean nearBottom = !nearTop && Math.abs(y - normalized.bottom()) <= margin;

        if (nearTop && nearLeft) return PointPosition.TOP_LEFT_CORNER;
        if (nearTop && nearRight) return PointPosition.TOP_RIGHT_CORNER;
        if (nearBottom && nearLeft) return PointPosition.BOTTOM_LEFT_CORNER;
        if (nearBottom && nearRight) return PointPosition.BOTTOM_RIGHT_CORNER;
        if (nearTop) return PointPosition.TOP_BORDER;
        if (nearBottom) return PointPosition.BOTTOM_BORDER;
        if (nearLeft) return PointPosition.LEFT_BORDER;
        if (nearRight) return PointPosition.RIGHT_BORDER;
        return PointPosition.IN_BOX;
    }

    public boolean contains(Point2D point, double margin) {
        return classifyPoint(point, margin) != PointPosition.NOT_IN_BOX;
    }
}
