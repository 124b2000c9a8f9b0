package org.pragmatica.slides.model;

import java.util.List;
import java.util.Optional;

/**
 * A pre-compiled document whose frames supply default boxes. A document frame with class
 * {@code c} borrows the boxes of the template frame with id {@code c}.
 *
 * <p>The template must stay alive as long as any document borrowing from it.
 */
public record Template(String name, FrameList frames) {

    public List<Box> boxesFor(Optional<String> frameClass) {
        return frameClass.flatMap(frames::findFrame)
                         .map(Frame::boxes)
                         .orElse(List.of());
    }

    /**
     * Attach borrowed template boxes to every frame of {@code document}.
     */
    public FrameList applyTo(FrameList document) {
        return new FrameList(document.stream()
                                     .map(frame -> frame.withTemplateBoxes(boxesFor(frame.frameClass())))
                                     .toList());
    }
}
