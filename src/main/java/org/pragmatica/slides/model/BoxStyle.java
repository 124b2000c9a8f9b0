package org.pragmatica.slides.model;

/**
 * Visual and layout attributes of a box.
 *
 * @param color       named or {@code #rrggbb} color
 * @param opacity     0 (transparent) to 1 (opaque)
 * @param font        font family
 * @param fontSize    font size in canvas units
 * @param fontWeight  normal or bold
 * @param lineSpacing line spacing multiplier
 * @param alignment   horizontal text alignment
 * @param boxClass    free-form class tag, e.g. {@code title} or {@code body}
 * @param language    source language of code boxes, empty otherwise
 * @param geometry    rectangle and rotation
 */
public record BoxStyle(
    String color,
    double opacity,
    String font,
    int fontSize,
    FontWeight fontWeight,
    double lineSpacing,
    TextAlignment alignment,
    String boxClass,
    String language,
    BoxGeometry geometry
) {
    public static final BoxStyle DEFAULT = new BoxStyle(
        "black",
        1.0,
        "Sans",
        50,
        FontWeight.NORMAL,
        1.0,
        TextAlignment.LEFT,
        "",
        "",
        BoxGeometry.EMPTY
    );

    public BoxStyle withColor(String value) {
        return new BoxStyle(value, opacity, font, fontSize, fontWeight, lineSpacing, alignment, boxClass, language, geometry);
    }

    public BoxStyle withOpacity(double value) {
        return new BoxStyle(color, value, font, fontSize, fontWeight, lineSpacing, alignment, boxClass, language, geometry);
    }

    public BoxStyle withFont(String value) {
        return new BoxStyle(color, opacity, value, fontSize, fontWeight, lineSpacing, alignment, boxClass, language, geometry);
    }

    public BoxStyle withFontSize(int value) {
        return new BoxStyle(color, opacity, font, value, fontWeight, lineSpacing, alignment, boxClass, language, geometry);
    }

    public BoxStyle withFontWeight(FontWeight value) {
        return new BoxStyle(color, opacity, font, fontSize, value, lineSpacing, alignment, boxClass, language, geometry);
    }

    public BoxStyle withLineSpacing(double value) {
        return new BoxStyle(color, opacity, font, fontSize, fontWeight, value, alignment, boxClass, language, geometry);
    }

    public BoxStyle withAlignment(TextAlignment value) {
        return new BoxStyle(color, opacity, font, fontSize, fontWeight, lineSpacing, value, boxClass, language, geometry);
    }

    public BoxStyle withBoxClass(String value) {
        return new BoxStyle(color, opacity, font, fontSize, fontWeight, lineSpacing, alignment, value, language, geometry);
    }

    public BoxStyle withLanguage(String value) {
        return new BoxStyle(color, opacity, font, fontSize, fontWeight, lineSpacing, alignment, boxClass, value, geometry);
    }

    public BoxStyle withGeometry(BoxGeometry value) {
        return new BoxStyle(color, opacity, font, fontSize, fontWeight, lineSpacing, alignment, boxClass, language, value);
    }
}
