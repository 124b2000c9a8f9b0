package org.pragmatica.slides.edit;

import org.pragmatica.slides.model.PointPosition;

/**
 * Chooses the cursor icon for a hit-test result.
 */
public final class CursorFeedback {
    private CursorFeedback() {}

    /**
     * @param type     active edit mode
     * @param position classification of the pointer against the selected box
     * @param angle    the box's rotation in degrees
     */
    public static CursorShape cursorFor(TransformationType type, PointPosition position, double angle) {
        return switch (type) {
            case TRANSLATE -> translateCursor(position, angle);
            case ROTATE -> rotateCursor(position);
        };
    }

    private static CursorShape translateCursor(PointPosition position, double angle) {
        return switch (position) {
            case LEFT_BORDER -> angleToCursor(angle);
            case TOP_LEFT_CORNER -> angleToCursor(45 + angle);
            case TOP_BORDER -> angleToCursor(90 + angle);
            case TOP_RIGHT_CORNER -> angleToCursor(135 + angle);
            case RIGHT_BORDER -> angleToCursor(180 + angle);
            case BOTTOM_RIGHT_CORNER -> angleToCursor(225 + angle);
            case BOTTOM_BORDER -> angleToCursor(270 + angle);
            case BOTTOM_LEFT_CORNER -> angleToCursor(315 + angle);
            case IN_BOX -> CursorShape.SIZE_ALL;
            case NOT_IN_BOX -> CursorShape.ARROW;
        };
    }

    private static CursorShape rotateCursor(PointPosition position) {
        if (position.isCorner()) {
            return CursorShape.CROSS;
        }
        return position == PointPosition.IN_BOX
               ? CursorShape.SIZE_ALL
               : CursorShape.ARROW;
    }

    /**
     * Resize icon for a drag direction. Opposite directions share an icon, so the angle is
     * reduced modulo 180 and bucketed into 45 degree sectors centered on the icon axes.
     */
    static CursorShape angleToCursor(double angle) {
        double reduced = ((angle % 180) + 180) % 180;
        if (reduced >= 157.5 || reduced < 22.5) {
            return CursorShape.SIZE_HORIZONTAL;
        }
        if (reduced < 67.5) {
            return CursorShape.SIZE_FORWARD_DIAGONAL;
        }
        if (reduced < 112.5) {
            return CursorShape.SIZE_VERTICAL;
        }
        return CursorShape.SIZE_BACKWARD_DIAGONAL;
    }
}
