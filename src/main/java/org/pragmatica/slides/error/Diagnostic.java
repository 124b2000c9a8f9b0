package org.pragmatica.slides.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler-style rendering of a {@link ParserError} with a source excerpt.
 *
 * <p>Example output:
 * <pre>
 * error: frame id already exist
 *   --> talk.slides:7
 *    |
 *  6 | \text Second slide
 *  7 | \frame intro
 *    | ^^^^^^^^^^^^
 *    |
 *    = help: every \frame needs a unique id
 * </pre>
 *
 * @param severity  severity level
 * @param message   primary message
 * @param line      0-based line the diagnostic points at
 * @param notes     additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String message,
    int line,
    List<String> notes
) {
    private static final int CONTEXT_LINES = 1;

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(ParserError error) {
        return new Diagnostic(Severity.ERROR, error.message(), error.line(), List.of());
    }

    public static Diagnostic warning(String message, int line) {
        return new Diagnostic(Severity.WARNING, message, line, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, line, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending line and one line of leading context.
     *
     * @param source   the compiled text
     * @param filename optional file name, may be null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        int displayLine = line + 1;

        sb.append(severity.display()).append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(displayLine).append("\n");

        int first = Math.max(1, displayLine - CONTEXT_LINES);
        int gutterWidth = String.valueOf(displayLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = first; lineNum <= displayLine; lineNum++) {
            if (lineNum > lines.length) break;

            var content = stripCarriageReturn(lines[lineNum - 1]);
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");

            if (lineNum == displayLine) {
                sb.append(" ".repeat(gutterWidth)).append(" | ").append(underline(content)).append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line format for status bars.
     */
    public String formatSimple() {
        return String.format("%s:%d: %s: %s", "input", line + 1, severity.display(), message);
    }

    private static String underline(String content) {
        int start = 0;
        while (start < content.length() && Character.isWhitespace(content.charAt(start))) {
            start++;
        }
        int end = content.stripTrailing().length();
        return " ".repeat(start) + "^".repeat(Math.max(1, end - start));
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
