package org.pragmatica.slides.render;

import org.pragmatica.slides.model.Box;

import java.util.Optional;

/**
 * Backend hook that paints a single box. Implemented by screen and PDF renderers.
 */
@FunctionalInterface
public interface BoxPainter {

    /**
     * @param box     the box, with style and geometry
     * @param content text or image source after variable substitution
     */
    void paint(Box box, Optional<String> content);
}
