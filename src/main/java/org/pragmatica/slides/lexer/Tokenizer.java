package org.pragmatica.slides.lexer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Streaming lexer for slide markup.
 *
 * <p>Commands start with a backslash followed by a letter. Directly after a command the lexer
 * accepts {@code name=value} arguments; anything else is text. Bare text runs up to the next
 * command, so it may span several lines; {@code \\} inside text is a literal backslash.
 * Quoted text keeps its content verbatim apart from the {@code \"} and {@code \\} escapes.
 */
public final class Tokenizer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private String input = "";
    private int pos;
    private int line;
    private boolean argumentPosition;
    private boolean pendingValue;
    private Token lookahead;

    public void loadInput(String text) {
        this.input = text;
        this.pos = 0;
        this.line = 0;
        this.argumentPosition = false;
        this.pendingValue = false;
        this.lookahead = null;
    }

    /**
     * Load UTF-8 encoded markup from a stream. The stream is read fully but not closed.
     */
    public void loadInput(InputStream stream) throws IOException {
        loadInput(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    public Token next() {
        if (lookahead != null) {
            var token = lookahead;
            lookahead = null;
            return token;
        }
        return scan();
    }

    public Token peekNext() {
        if (lookahead == null) {
            lookahead = scan();
        }
        return lookahead;
    }

    private Token scan() {
        if (pendingValue) {
            pendingValue = false;
            return scanArgumentValue();
        }
        skipWhitespace();
        if (isAtEnd()) {
            return Token.endOfFile(line);
        }
        if (isCommandStart()) {
            argumentPosition = true;
            return scanCommand();
        }
        if (argumentPosition && isArgumentStart()) {
            return scanArgument();
        }
        argumentPosition = false;
        if (peek() == '"') {
            return scanQuotedText();
        }
        return scanBareText();
    }

    private Token scanCommand() {
        int startLine = line;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token(Token.Kind.COMMAND, sb.toString(), startLine);
    }

    private Token scanArgument() {
        int startLine = line;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (peek() != '=') {
            sb.append(advance());
        }
        // skip '='
        advance();
        pendingValue = true;
        return new Token(Token.Kind.ARGUMENT, sb.toString(), startLine);
    }

    private Token scanArgumentValue() {
        int startLine = line;
        if (!isAtEnd() && peek() == '"') {
            return new Token(Token.Kind.ARGUMENT_VALUE, scanQuoted(), startLine);
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && !Character.isWhitespace(peek())) {
            sb.append(advance());
        }
        return new Token(Token.Kind.ARGUMENT_VALUE, sb.toString(), startLine);
    }

    private Token scanQuotedText() {
        int startLine = line;
        var text = scanQuoted();
        return new Token(textKind(text), text, startLine);
    }

    private String scanQuoted() {
        // opening quote
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length() && isQuotedEscape(peek(1))) {
                advance();
            }
            sb.append(advance());
        }
        if (!isAtEnd()) {
            advance();
        }
        return normalizeLineEnds(sb.toString());
    }

    private Token scanBareText() {
        int startLine = line;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && !isCommandStart()) {
            if (peek() == '\\' && pos + 1 < input.length() && peek(1) == '\\') {
                advance();
            }
            sb.append(advance());
        }
        var text = normalizeLineEnds(sb.toString()).strip();
        return new Token(textKind(text), text, startLine);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isCommandStart() {
        return peek() == '\\' && pos + 1 < input.length() && isLetter(peek(1));
    }

    /**
     * An identifier immediately followed by '='.
     */
    private boolean isArgumentStart() {
        if (!isLetter(peek()) && peek() != '_') {
            return false;
        }
        int lookaheadPos = pos + 1;
        while (lookaheadPos < input.length() && isIdentifierPart(input.charAt(lookaheadPos))) {
            lookaheadPos++;
        }
        return lookaheadPos < input.length() && input.charAt(lookaheadPos) == '=';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peek(int offset) {
        return input.charAt(pos + offset);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
        }
        return c;
    }

    private static Token.Kind textKind(String text) {
        return text.indexOf('\n') >= 0
               ? Token.Kind.MULTI_LINE_TEXT
               : Token.Kind.TEXT;
    }

    private static String normalizeLineEnds(String text) {
        return text.replace("\r\n", "\n");
    }

    private static boolean isQuotedEscape(char c) {
        return c == '"' || c == '\\';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}
