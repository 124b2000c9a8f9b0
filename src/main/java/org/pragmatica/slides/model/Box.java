package org.pragmatica.slides.model;

import java.awt.geom.Point2D;
import java.util.Optional;

/**
 * A positioned content element of a frame.
 *
 * <p>Boxes are immutable; geometry edits produce a copy via {@link #withGeometry(BoxGeometry)}.
 * The {@link #id()} is the only identity that survives a re-compile.
 */
public sealed interface Box {
    /**
     * Unique id within the document, either explicit ({@code id=...}) or generated.
     */
    String id();

    BoxStyle style();

    /**
     * Reveal group: the number of {@code \pause} commands preceding the box in its frame.
     */
    int pauseCounter();

    /**
     * 0-based source line of the command that created the box.
     */
    int line();

    Box withStyle(BoxStyle style);

    default BoxGeometry geometry() {
        return style().geometry();
    }

    default Box withGeometry(BoxGeometry geometry) {
        return withStyle(style().withGeometry(geometry));
    }

    /**
     * Text or resource reference carried by the box, before variable substitution.
     */
    default Optional<String> content() {
        return Optional.empty();
    }

    default boolean containsPoint(Point2D point, double margin) {
        return geometry().contains(point, margin);
    }

    default boolean visibleAt(int revealCount) {
        return pauseCounter() <= revealCount;
    }

    /**
     * Rich text: {@code \text}, {@code \body} and {@code \blindtext}.
     */
    record TextBox(String id, String text, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new TextBox(id, text, style, pauseCounter, line);
        }

        @Override
        public Optional<String> content() {
            return Optional.of(text);
        }
    }

    /**
     * Text drawn without markup interpretation: {@code \plaintext}.
     */
    record PlainTextBox(String id, String text, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new PlainTextBox(id, text, style, pauseCounter, line);
        }

        @Override
        public Optional<String> content() {
            return Optional.of(text);
        }
    }

    /**
     * Frame heading: {@code \title}.
     */
    record TitleBox(String id, String text, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new TitleBox(id, text, style, pauseCounter, line);
        }

        @Override
        public Optional<String> content() {
            return Optional.of(text);
        }
    }

    /**
     * Source code listing: {@code \code}. The language comes from {@link BoxStyle#language()}.
     */
    record CodeBox(String id, String text, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new CodeBox(id, text, style, pauseCounter, line);
        }

        @Override
        public Optional<String> content() {
            return Optional.of(text);
        }
    }

    /**
     * Raster or vector image: {@code \image}. The source is a path, usually below {@code %{resourcepath}}.
     */
    record ImageBox(String id, String source, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new ImageBox(id, source, style, pauseCounter, line);
        }

        @Override
        public Optional<String> content() {
            return Optional.of(source);
        }
    }

    /**
     * Arrow from the left to the right edge of the rectangle: {@code \arrow}.
     */
    record ArrowBox(String id, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new ArrowBox(id, style, pauseCounter, line);
        }
    }

    /**
     * Plain line along the rectangle: {@code \line}.
     */
    record LineBox(String id, BoxStyle style, int pauseCounter, int line) implements Box {
        @Override
        public Box withStyle(BoxStyle style) {
            return new LineBox(id, style, pauseCounter, line);
        }
    }
}
