package org.pragmatica.slides.model;

public enum FontWeight {
    NORMAL,
    BOLD
}
