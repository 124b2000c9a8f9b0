package org.pragmatica.slides.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Horizontal text alignment inside a box.
 */
public enum TextAlignment {
    LEFT("left"),
    RIGHT("right"),
    CENTER("center"),
    JUSTIFY("justify");

    private final String keyword;

    TextAlignment(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<TextAlignment> fromKeyword(String keyword) {
        return Arrays.stream(values())
                     .filter(alignment -> alignment.keyword().equals(keyword))
                     .findFirst();
    }
}
