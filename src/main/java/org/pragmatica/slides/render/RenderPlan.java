package org.pragmatica.slides.render;

import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.Frame;
import org.pragmatica.slides.model.Variables;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a renderer draws for one frame: template boxes first, then the frame's own boxes,
 * each with its content after variable substitution.
 *
 * @param frame the planned frame
 * @param items boxes in paint order
 */
public record RenderPlan(Frame frame, List<Item> items) {

    /**
     * One box and its substituted content; empty for boxes without content such as arrows.
     */
    public record Item(Box box, Optional<String> content, boolean fromTemplate) {}

    /**
     * Plan the complete frame.
     */
    public static RenderPlan of(Frame frame) {
        return of(frame, Integer.MAX_VALUE);
    }

    /**
     * Plan the frame as shown after {@code revealCount} pauses. Template boxes are always shown.
     */
    public static RenderPlan of(Frame frame, int revealCount) {
        var variables = frame.variables();
        var items = new ArrayList<Item>();
        for (var box : frame.templateBoxes()) {
            items.add(new Item(box, box.content().map(text -> Variables.substitute(text, variables)), true));
        }
        for (var box : frame.boxes()) {
            if (box.visibleAt(revealCount)) {
                items.add(new Item(box, box.content().map(text -> Variables.substitute(text, variables)), false));
            }
        }
        return new RenderPlan(frame, List.copyOf(items));
    }

    /**
     * Number of reveal steps of a frame: highest pause counter plus one.
     */
    public static int pauseCount(Frame frame) {
        return frame.boxes()
                    .stream()
                    .mapToInt(Box::pauseCounter)
                    .max()
                    .orElse(0) + 1;
    }
}
