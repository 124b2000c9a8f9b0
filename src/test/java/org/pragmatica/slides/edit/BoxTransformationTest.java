package org.pragmatica.slides.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.slides.CompileResult;
import org.pragmatica.slides.SlideCompiler;
import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.BoxGeometry;
import org.pragmatica.slides.model.PointPosition;
import org.pragmatica.slides.model.Presentation;

import java.awt.geom.Point2D;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

class BoxTransformationTest {

    private static final double EPSILON = 1e-6;

    private Presentation presentation;

    @BeforeEach
    void setUp() {
        presentation = new Presentation();
    }

    private Box load(String geometryArguments) {
        var result = SlideCompiler.create().compile("\\frame a\n\\text id=box " + geometryArguments + " content");
        presentation.setFrames(((CompileResult.Success) result).frames());
        return presentation.findBox("box").orElseThrow();
    }

    private BoxGeometry stored() {
        return presentation.findBox("box").orElseThrow().geometry();
    }

    private static Point2D point(double x, double y) {
        return new Point2D.Double(x, y);
    }

    private static Point2D world(BoxGeometry geometry, double localX, double localY) {
        return geometry.transform().transform(point(localX, localY), null);
    }

    @Test
    void translate_inBox_movesIncrementally() {
        var box = load("left=100 top=100 width=200 height=100");
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.IN_BOX, 0, point(150, 150));

        gesture.doTransformation(point(160, 145), presentation);
        gesture.doTransformation(point(170, 145), presentation);

        assertEquals(new BoxGeometry(120, 95, 200, 100, 0), stored());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, 30, 90, -135})
    void translate_bottomRightCorner_growsAndKeepsTopLeftFixed(double angle) {
        var box = load("left=100 top=100 width=200 height=100 angle=" + angle);
        var before = box.geometry();
        var topLeft = world(before, 100, 100);
        var bottomRight = world(before, 300, 200);
        // pointer offset (+30, +20) measured along the box's own axes
        var offset = before.transform(point(0, 0)).transform(point(30, 20), null);
        var pointer = point(bottomRight.getX() + offset.getX(), bottomRight.getY() + offset.getY());
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.BOTTOM_RIGHT_CORNER, 0, bottomRight);

        var after = gesture.doTransformation(pointer, presentation);

        assertThat(after.width()).isCloseTo(230, within(EPSILON));
        assertThat(after.height()).isCloseTo(120, within(EPSILON));
        assertThat(after.angle()).isEqualTo(angle);
        var newTopLeft = world(after, after.left(), after.top());
        assertThat(newTopLeft.getX()).isCloseTo(topLeft.getX(), within(EPSILON));
        assertThat(newTopLeft.getY()).isCloseTo(topLeft.getY(), within(EPSILON));
        assertEquals(after, stored());
    }

    @Test
    void translate_topLeftCorner_keepsBottomRightFixed() {
        var box = load("left=0 top=0 width=100 height=100 angle=45");
        var before = box.geometry();
        var bottomRight = world(before, 100, 100);
        var topLeft = world(before, 0, 0);
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.TOP_LEFT_CORNER, 0, topLeft);

        var after = gesture.doTransformation(world(before, -10, -10), presentation);

        assertThat(after.width()).isCloseTo(110, within(EPSILON));
        assertThat(after.height()).isCloseTo(110, within(EPSILON));
        var newBottomRight = world(after, after.right(), after.bottom());
        assertThat(newBottomRight.getX()).isCloseTo(bottomRight.getX(), within(EPSILON));
        assertThat(newBottomRight.getY()).isCloseTo(bottomRight.getY(), within(EPSILON));
    }

    @Test
    void translate_rightBorder_changesWidthOnly() {
        var box = load("left=0 top=0 width=100 height=50");
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.RIGHT_BORDER, 0, point(100, 25));

        var after = gesture.doTransformation(point(150, 80), presentation);

        assertEquals(new BoxGeometry(0, 0, 150, 50, 0), after);
    }

    @Test
    void translate_dragPastOppositeEdge_flipsWithoutNegativeExtent() {
        var box = load("left=0 top=0 width=100 height=100");
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.BOTTOM_RIGHT_CORNER, 0, point(100, 100));

        var after = gesture.doTransformation(point(-50, 50), presentation);

        assertEquals(new BoxGeometry(-50, 0, 50, 50, 0), after);
    }

    @Test
    void translate_furtherMovesAfterFlip_keepStartingAnchor() {
        var box = load("left=0 top=0 width=100 height=100");
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.BOTTOM_RIGHT_CORNER, 0, point(100, 100));

        gesture.doTransformation(point(-50, 50), presentation);
        var flipped = gesture.doTransformation(point(-60, 60), presentation);
        assertEquals(new BoxGeometry(-60, 0, 60, 60, 0), flipped);

        var restored = gesture.doTransformation(point(150, 120), presentation);
        assertEquals(new BoxGeometry(0, 0, 150, 120, 0), restored);
        assertEquals(restored, stored());
    }

    @Test
    void translate_rotatedFlip_keepsAnchorInWorldSpace() {
        var box = load("left=100 top=100 width=200 height=100 angle=30");
        var before = box.geometry();
        var topLeft = world(before, 100, 100);
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.BOTTOM_RIGHT_CORNER, 0, world(before, 300, 200));

        gesture.doTransformation(world(before, 50, 150), presentation);
        var after = gesture.doTransformation(world(before, 40, 160), presentation);

        assertThat(after.width()).isCloseTo(60, within(EPSILON));
        assertThat(after.height()).isCloseTo(60, within(EPSILON));
        var anchor = world(after, after.right(), after.top());
        assertThat(anchor.getX()).isCloseTo(topLeft.getX(), within(EPSILON));
        assertThat(anchor.getY()).isCloseTo(topLeft.getY(), within(EPSILON));
    }

    @Test
    void translate_notInBox_leavesGeometryUnchanged() {
        var box = load("left=0 top=0 width=100 height=100");
        var events = new int[1];
        presentation.addListener(new Presentation.Listener() {
            @Override
            public void presentationChanged() {}

            @Override
            public void frameChanged(int frameIndex) {
                events[0]++;
            }
        });
        var gesture = new BoxTransformation(box, TransformationType.TRANSLATE, PointPosition.NOT_IN_BOX, 0, point(300, 300));

        var after = gesture.doTransformation(point(400, 400), presentation);

        assertEquals(box.geometry(), after);
        assertEquals(0, events[0]);
    }

    @Test
    void rotate_topLeftCornerAtOwnPosition_keepsZeroAngle() {
        var box = load("left=0 top=0 width=100 height=100");
        var gesture = new BoxTransformation(box, TransformationType.ROTATE, PointPosition.TOP_LEFT_CORNER, 0, point(0, 0));

        var after = gesture.doTransformation(point(0, 0), presentation);

        assertThat(after.angle()).isCloseTo(0, within(EPSILON));
    }

    @Test
    void rotate_topLeftCornerToTopRight_isQuarterTurn() {
        var box = load("left=0 top=0 width=100 height=100");
        var gesture = new BoxTransformation(box, TransformationType.ROTATE, PointPosition.TOP_LEFT_CORNER, 0, point(0, 0));

        var after = gesture.doTransformation(point(100, 0), presentation);

        assertThat(after.angle()).isCloseTo(90, within(EPSILON));
        assertEquals(0, after.left());
        assertEquals(100, after.width());
    }

    @Test
    void rotate_bottomRightCornerAtOwnPosition_keepsZeroAngle() {
        var box = load("left=0 top=0 width=200 height=100");
        var gesture = new BoxTransformation(box, TransformationType.ROTATE, PointPosition.BOTTOM_RIGHT_CORNER, 0, point(200, 100));

        var after = gesture.doTransformation(point(200, 100), presentation);

        assertThat(after.angle()).isCloseTo(0, within(EPSILON));
    }

    @Test
    void rotate_inBox_translates() {
        var box = load("left=0 top=0 width=100 height=100 angle=10");
        var gesture = new BoxTransformation(box, TransformationType.ROTATE, PointPosition.IN_BOX, 0, point(50, 50));

        var after = gesture.doTransformation(point(55, 40), presentation);

        assertEquals(new BoxGeometry(5, -10, 100, 100, 10), after);
    }

    @Test
    void rotate_border_isNoOp() {
        var box = load("left=0 top=0 width=100 height=100");
        var gesture = new BoxTransformation(box, TransformationType.ROTATE, PointPosition.TOP_BORDER, 0, point(50, 0));

        assertEquals(box.geometry(), gesture.doTransformation(point(80, -40), presentation));
    }
}
