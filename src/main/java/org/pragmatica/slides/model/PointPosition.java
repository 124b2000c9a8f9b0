package org.pragmatica.slides.model;

/**
 * Where a point lies relative to a box's rotated rectangle.
 */
public enum PointPosition {
    TOP_LEFT_CORNER,
    TOP_RIGHT_CORNER,
    BOTTOM_LEFT_CORNER,
    BOTTOM_RIGHT_CORNER,
    TOP_BORDER,
    BOTTOM_BORDER,
    LEFT_BORDER,
    RIGHT_BORDER,
    IN_BOX,
    NOT_IN_BOX;

    public boolean isCorner() {
        return this == TOP_LEFT_CORNER
            || this == TOP_RIGHT_CORNER
            || this == BOTTOM_LEFT_CORNER
            || this == BOTTOM_RIGHT_CORNER;
    }
}
