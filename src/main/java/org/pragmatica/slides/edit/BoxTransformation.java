package org.pragmatica.slides.edit;

import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.BoxGeometry;
import org.pragmatica.slides.model.PointPosition;
import org.pragmatica.slides.model.Presentation;

import java.awt.geom.Point2D;

/**
 * One pointer drag on one box, from pointer-down to pointer-up.
 *
 * <p>Each {@link #doTransformation(Point2D, Presentation)} call derives a new geometry from the
 * previous one and writes it into the presentation. Moves are incremental (pointer delta since the
 * last call); resizes and rotations are absolute with respect to the pointer.
 */
public final class BoxTransformation {
    private final String boxId;
    private final TransformationType type;
    private final PointPosition position;
    private final int frameIndex;
    private final BoxGeometry anchored;
    private final Point2D anchorWorld;
    private Point2D lastPointer;
    private BoxGeometry geometry;

    public BoxTransformation(Box box, TransformationType type, PointPosition position, int frameIndex, Point2D pointer) {
        this.boxId = box.id();
        this.type = type;
        this.position = position;
        this.frameIndex = frameIndex;
        this.lastPointer = pointer;
        this.geometry = box.geometry();

        // the resize anchor is fixed in world space for the whole gesture
        var start = geometry.normalized();
        var anchorLocal = anchorFor(start);
        this.anchorWorld = start.transform().transform(anchorLocal, null);
        this.anchored = start.translated(anchorWorld.getX() - anchorLocal.getX(),
                                         anchorWorld.getY() - anchorLocal.getY());
    }

    public String boxId() {
        return boxId;
    }

    public TransformationType type() {
        return type;
    }

    public PointPosition position() {
        return position;
    }

    public int frameIndex() {
        return frameIndex;
    }

    public BoxGeometry geometry() {
        return geometry;
    }

    /**
     * Apply the pointer position and write the resulting geometry back.
     *
     * @return the new geometry, unchanged when the gesture started outside the box
     */
    public BoxGeometry doTransformation(Point2D pointer, Presentation presentation) {
        var updated = switch (type) {
            case TRANSLATE -> scaleTransformation(pointer);
            case ROTATE -> rotateTransformation(pointer);
        };
        lastPointer = pointer;
        if (!updated.equals(geometry)) {
            geometry = updated;
            presentation.setBoxGeometry(boxId, updated, frameIndex);
        }
        return geometry;
    }

    private BoxGeometry scaleTransformation(Point2D pointer) {
        if (position == PointPosition.IN_BOX) {
            return move(pointer);
        }
        if (position == PointPosition.NOT_IN_BOX) {
            return geometry;
        }
        return resize(pointer);
    }

    private BoxGeometry move(Point2D pointer) {
        return geometry.translated(pointer.getX() - lastPointer.getX(), pointer.getY() - lastPointer.getY());
    }

    /**
     * Keep the edge or corner opposite the dragged one at its world position from the start of the
     * gesture and move the dragged one to the pointer, measured in the box's rotated frame.
     */
    private BoxGeometry resize(Point2D pointer) {
        double left = anchored.left();
        double top = anchored.top();
        double right = anchored.right();
        double bottom = anchored.bottom();

        var localPointer = anchored.inverseTransform(anchorWorld).transform(pointer, null);
        switch (position) {
            case TOP_LEFT_CORNER -> {
                left = localPointer.getX();
                top = localPointer.getY();
            }
            case TOP_RIGHT_CORNER -> {
                right = localPointer.getX();
                top = localPointer.getY();
            }
            case BOTTOM_LEFT_CORNER -> {
                left = localPointer.getX();
                bottom = localPointer.getY();
            }
            case BOTTOM_RIGHT_CORNER -> {
                right = localPointer.getX();
                bottom = localPointer.getY();
            }
            case TOP_BORDER -> top = localPointer.getY();
            case BOTTOM_BORDER -> bottom = localPointer.getY();
            case LEFT_BORDER -> left = localPointer.getX();
            case RIGHT_BORDER -> right = localPointer.getX();
            default -> {
                return geometry;
            }
        }

        var localCenter = new Point2D.Double((left + right) / 2, (top + bottom) / 2);
        var center = anchored.transform(anchorWorld).transform(localCenter, null);
        double width = Math.abs(right - left);
        double height = Math.abs(bottom - top);
        return new BoxGeometry(center.getX() - width / 2, center.getY() - height / 2, width, height, anchored.angle());
    }

    private Point2D anchorFor(BoxGeometry start) {
        return switch (position) {
            case TOP_LEFT_CORNER, LEFT_BORDER -> new Point2D.Double(start.right(), start.bottom());
            case TOP_RIGHT_CORNER, TOP_BORDER -> new Point2D.Double(start.left(), start.bottom());
            case BOTTOM_LEFT_CORNER -> new Point2D.Double(start.right(), start.top());
            default -> new Point2D.Double(start.left(), start.top());
        };
    }

    private BoxGeometry rotateTransformation(Point2D pointer) {
        if (position == PointPosition.IN_BOX) {
            return move(pointer);
        }
        if (!position.isCorner()) {
            return geometry;
        }
        var center = geometry.center();
        double mouseAngle = Math.atan2(center.getY() - pointer.getY(), center.getX() - pointer.getX());
        double angleCenterEdge = Math.atan2(geometry.height(), geometry.width());
        double rectAngle = switch (position) {
            case TOP_LEFT_CORNER -> mouseAngle - angleCenterEdge;
            case BOTTOM_LEFT_CORNER -> mouseAngle + angleCenterEdge;
            case BOTTOM_RIGHT_CORNER -> mouseAngle + Math.PI - angleCenterEdge;
            default -> mouseAngle - Math.PI + angleCenterEdge;
        };
        return geometry.withAngle(Math.toDegrees(rectAngle));
    }
}
