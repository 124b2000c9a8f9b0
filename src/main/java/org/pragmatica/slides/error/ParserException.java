package org.pragmatica.slides.error;

/**
 * Carries a {@link ParserError} out of the parser. Parsing stops at the first one.
 */
public final class ParserException extends RuntimeException {
    private final ParserError error;

    public ParserException(ParserError error) {
        super(error.toString());
        this.error = error;
    }

    public static ParserException at(int line, String message) {
        return new ParserException(ParserError.at(line, message));
    }

    public ParserError error() {
        return error;
    }
}
