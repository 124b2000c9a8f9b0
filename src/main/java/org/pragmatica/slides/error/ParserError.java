package org.pragmatica.slides.error;

/**
 * The single error produced by a failed compile.
 *
 * @param message human readable description
 * @param line    0-based source line of the offending token
 */
public record ParserError(String message, int line) {

    public static ParserError at(int line, String message) {
        return new ParserError(message, line);
    }

    /**
     * Line number as shown to users (1-based).
     */
    public int displayLine() {
        return line + 1;
    }

    @Override
    public String toString() {
        return "Line " + displayLine() + ": " + message;
    }
}
