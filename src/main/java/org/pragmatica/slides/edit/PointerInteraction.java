package org.pragmatica.slides.edit;

import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.PointPosition;
import org.pragmatica.slides.model.Presentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.util.Optional;

/**
 * Pointer handling for the slide canvas: selection, gesture lifecycle and cursor feedback.
 *
 * <p>Coordinates are logical canvas coordinates. A press arms the interaction; the first move
 * further than {@code margin / 5} (manhattan) over the selected box starts a
 * {@link BoxTransformation}, which lives until release. A release without a drag selects the next
 * box under the pointer.
 */
public final class PointerInteraction {
    private static final Logger log = LoggerFactory.getLogger(PointerInteraction.class);

    public static final double DEFAULT_MARGIN = 15;

    private final Presentation presentation;
    private final double margin;
    private TransformationType transformationType = TransformationType.TRANSLATE;
    private int frameIndex;
    private String selectedBoxId;
    private Point2D lastPosition;
    private BoxTransformation gesture;

    public PointerInteraction(Presentation presentation) {
        this(presentation, DEFAULT_MARGIN);
    }

    public PointerInteraction(Presentation presentation, double margin) {
        this.presentation = presentation;
        this.margin = margin;
    }

    public void setTransformationType(TransformationType type) {
        this.transformationType = type;
    }

    public TransformationType transformationType() {
        return transformationType;
    }

    public int frameIndex() {
        return frameIndex;
    }

    public void setFrameIndex(int index) {
        if (index < 0 || index >= presentation.size()) {
            return;
        }
        if (index != frameIndex) {
            selectedBoxId = null;
        }
        frameIndex = index;
    }

    public Optional<String> selectedBoxId() {
        return Optional.ofNullable(selectedBoxId);
    }

    public void select(String boxId) {
        this.selectedBoxId = boxId;
    }

    public Optional<BoxTransformation> gesture() {
        return Optional.ofNullable(gesture);
    }

    public void pointerDown(Point2D position) {
        if (presentation.isEmpty()) {
            return;
        }
        gesture = null;
        lastPosition = position;
    }

    /**
     * Handle a move while the button is held.
     *
     * @return the cursor to show
     */
    public CursorShape pointerDrag(Point2D position) {
        if (presentation.isEmpty() || lastPosition == null) {
            return CursorShape.ARROW;
        }
        if (manhattan(lastPosition, position) < margin / 5) {
            return cursorAt(position);
        }
        if (gesture == null) {
            var box = selectedBox();
            if (box.isEmpty()) {
                return CursorShape.ARROW;
            }
            var startPosition = box.get().geometry().classifyPoint(lastPosition, margin);
            if (startPosition == PointPosition.NOT_IN_BOX) {
                return CursorShape.ARROW;
            }
            log.debug("Starting {} of box {} at {}", transformationType, selectedBoxId, startPosition);
            gesture = new BoxTransformation(box.get(), transformationType, startPosition, frameIndex, lastPosition);
        }
        gesture.doTransformation(position, presentation);
        lastPosition = position;
        return cursorFor(gesture.position(), gesture.geometry().angle());
    }

    public void pointerUp(Point2D position) {
        if (presentation.isEmpty()) {
            return;
        }
        if (selectedBoxId == null || gesture == null) {
            determineBoxInFocus(position);
        }
        gesture = null;
        lastPosition = null;
    }

    /**
     * Cursor for a hover without a pressed button.
     */
    public CursorShape cursorAt(Point2D position) {
        var box = selectedBox();
        if (box.isEmpty()) {
            return CursorShape.ARROW;
        }
        var geometry = box.get().geometry();
        return cursorFor(geometry.classifyPoint(position, margin), geometry.angle());
    }

    private CursorShape cursorFor(PointPosition position, double angle) {
        return CursorFeedback.cursorFor(transformationType, position, angle);
    }

    /**
     * Select the first box containing the point, skipping the current selection so repeated
     * clicks cycle through stacked boxes.
     */
    private void determineBoxInFocus(Point2D position) {
        var lastId = selectedBoxId;
        selectedBoxId = null;
        for (var box : presentation.frameAt(frameIndex).boxes()) {
            if (box.containsPoint(position, 0) && !box.id().equals(lastId)) {
                selectedBoxId = box.id();
                break;
            }
        }
    }

    private Optional<Box> selectedBox() {
        if (selectedBoxId == null || frameIndex >= presentation.size()) {
            return Optional.empty();
        }
        return presentation.frameAt(frameIndex).findBox(selectedBoxId);
    }

    private static double manhattan(Point2D from, Point2D to) {
        return Math.abs(to.getX() - from.getX()) + Math.abs(to.getY() - from.getY());
    }
}
