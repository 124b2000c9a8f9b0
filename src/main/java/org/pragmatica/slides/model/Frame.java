package org.pragmatica.slides.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One slide of the compiled document.
 *
 * @param id            unique frame id
 * @param frameClass    optional class, selects the template frame to borrow from
 * @param boxes         boxes created by the frame's commands, in source order
 * @param templateBoxes boxes borrowed from the template; owned by the template
 * @param variables     variable snapshot taken when the frame was opened
 * @param line          0-based line of the {@code \frame} command
 */
public record Frame(
    String id,
    Optional<String> frameClass,
    List<Box> boxes,
    List<Box> templateBoxes,
    Map<String, String> variables,
    int line
) {
    public Frame {
        boxes = List.copyOf(boxes);
        variables = Map.copyOf(variables);
    }

    public boolean isEmpty() {
        return boxes.isEmpty() && templateBoxes.isEmpty();
    }

    public Optional<Box> findBox(String boxId) {
        return boxes.stream()
                    .filter(box -> box.id().equals(boxId))
                    .findFirst();
    }

    public Optional<String> variable(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    public Frame withTemplateBoxes(List<Box> borrowed) {
        return new Frame(id, frameClass, boxes, borrowed, variables, line);
    }

    /**
     * Copy with the geometry of one owned box replaced. Unknown ids leave the frame unchanged.
     */
    public Frame withBoxGeometry(String boxId, BoxGeometry geometry) {
        var updated = new ArrayList<Box>(boxes.size());
        for (var box : boxes) {
            updated.add(box.id().equals(boxId) ? box.withGeometry(geometry) : box);
        }
        return new Frame(id, frameClass, updated, templateBoxes, variables, line);
    }
}
