package org.pragmatica.slides.edit;

/**
 * Interactive edit mode, chosen per session rather than per box.
 */
public enum TransformationType {
    /**
     * Drag inside moves the box, drag on an edge or corner resizes it.
     */
    TRANSLATE,

    /**
     * Drag on a corner rotates the box, drag inside moves it.
     */
    ROTATE
}
