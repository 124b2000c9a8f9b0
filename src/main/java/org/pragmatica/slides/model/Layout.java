package org.pragmatica.slides.model;

/**
 * Canvas size and the named slots boxes snap to.
 */
public record Layout(double width, double height) {

    public static final Layout SIXTEEN_TO_NINE = new Layout(1600, 900);
    public static final Layout FOUR_TO_THREE = new Layout(1200, 900);

    private static final double MARGIN = 50;

    public enum Slot {
        TITLE,
        BODY,
        FULL,
        LEFT,
        RIGHT,
        PRESENTATION_TITLE,
        SUBTITLE
    }

    public BoxGeometry geometry(Slot slot) {
        double innerWidth = width - 2 * MARGIN;
        double titleHeight = height / 6;
        double bodyTop = titleHeight;
        double bodyHeight = height - titleHeight - MARGIN;
        double columnWidth = (innerWidth - MARGIN) / 2;
        return switch (slot) {
            case TITLE -> BoxGeometry.of(MARGIN, 0, innerWidth, titleHeight);
            case BODY -> BoxGeometry.of(MARGIN, bodyTop, innerWidth, bodyHeight);
            case FULL -> BoxGeometry.of(0, 0, width, height);
            case LEFT -> BoxGeometry.of(MARGIN, bodyTop, columnWidth, bodyHeight);
            case RIGHT -> BoxGeometry.of(width - MARGIN - columnWidth, bodyTop, columnWidth, bodyHeight);
            case PRESENTATION_TITLE -> BoxGeometry.of(MARGIN, height / 3 - titleHeight / 2, innerWidth, titleHeight);
            case SUBTITLE -> BoxGeometry.of(MARGIN, height / 2, innerWidth, titleHeight);
        };
    }
}
