package org.pragmatica.slides.edit;

/**
 * Pointer icons shown while hovering over the selected box.
 */
public enum CursorShape {
    ARROW,
    SIZE_HORIZONTAL,
    SIZE_VERTICAL,
    SIZE_FORWARD_DIAGONAL,
    SIZE_BACKWARD_DIAGONAL,
    SIZE_ALL,
    CROSS
}
