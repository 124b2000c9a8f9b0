package org.pragmatica.slides.render;

import org.pragmatica.slides.model.Frame;
import org.pragmatica.slides.model.FrameList;

/**
 * Walks frames in paint order and hands each box to a {@link BoxPainter}.
 */
public final class FramePainter {
    private final BoxPainter painter;

    public FramePainter(BoxPainter painter) {
        this.painter = painter;
    }

    public void paintFrame(Frame frame) {
        paint(RenderPlan.of(frame));
    }

    public void paintFrame(Frame frame, int revealCount) {
        paint(RenderPlan.of(frame, revealCount));
    }

    /**
     * Paint every reveal step of every frame, calling {@code pageBreak} between pages.
     * This is the page sequence of a progressive (non-handout) export.
     */
    public void paintSteps(FrameList frames, Runnable pageBreak) {
        boolean first = true;
        for (var frame : frames) {
            int steps = RenderPlan.pauseCount(frame);
            for (int step = 0; step < steps; step++) {
                if (!first) {
                    pageBreak.run();
                }
                first = false;
                paintFrame(frame, step);
            }
        }
    }

    private void paint(RenderPlan plan) {
        for (var item : plan.items()) {
            painter.paint(item.box(), item.content());
        }
    }
}
