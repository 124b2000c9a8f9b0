package org.pragmatica.slides.lexer;

/**
 * A lexical unit of slide markup.
 *
 * @param kind token category
 * @param text command name (with backslash), argument name, value or prose
 * @param line 0-based line the token starts on
 */
public record Token(Kind kind, String text, int line) {

    public enum Kind {
        COMMAND,
        ARGUMENT,
        ARGUMENT_VALUE,
        TEXT,
        MULTI_LINE_TEXT,
        END_OF_FILE
    }

    public static Token endOfFile(int line) {
        return new Token(Kind.END_OF_FILE, "", line);
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    public boolean isCommand(String name) {
        return kind == Kind.COMMAND && text.equals(name);
    }
}
