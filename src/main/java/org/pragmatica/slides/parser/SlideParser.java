package org.pragmatica.slides.parser;

import org.pragmatica.slides.error.ParserException;
import org.pragmatica.slides.lexer.Token;
import org.pragmatica.slides.lexer.Tokenizer;
import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.BoxStyle;
import org.pragmatica.slides.model.FontWeight;
import org.pragmatica.slides.model.Frame;
import org.pragmatica.slides.model.FrameList;
import org.pragmatica.slides.model.Layout;
import org.pragmatica.slides.model.TextAlignment;
import org.pragmatica.slides.model.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link FrameList} from slide markup.
 *
 * <p>A parser instance handles one input: call {@link #readPreamble()} (optional) and then
 * {@link #readInput()}. Both stop at the first malformed construct with a {@link ParserException}.
 */
public final class SlideParser {
    private static final Logger log = LoggerFactory.getLogger(SlideParser.class);

    static final String BLIND_TEXT = "Lorem ipsum dolor sit amet, consectetur adipisici elit, sed eiusmod tempor "
        + "incidunt ut labore et dolore magna aliqua. Ut enim ad minim veniam, quis nostrud exercitation ullamco "
        + "laboris nisi ut aliquid ex ea commodi consequat. Quis aute iure reprehenderit in voluptate velit esse "
        + "cillum dolore eu fugiat nulla pariatur. Excepteur sint obcaecat cupiditat non proident, sunt in culpa "
        + "qui officia deserunt mollit anim id est laborum.";

    private static final String MISSING_FRAME = "missing frame: type \\frame id";

    private final Tokenizer tokenizer = new Tokenizer();
    private final ParserConfig config;
    private final List<FrameDraft> frames = new ArrayList<>();
    private final Set<String> userIds = new HashSet<>();
    private final Map<String, String> variables = new HashMap<>();
    private Preamble preamble = Preamble.NONE;
    private int boxCounter;
    private int pauseCount;

    public SlideParser() {
        this(ParserConfig.DEFAULT);
    }

    public SlideParser(ParserConfig config) {
        this.config = config;
    }

    public void loadInput(String text) {
        tokenizer.loadInput(text);
    }

    public void loadInput(InputStream stream) throws IOException {
        tokenizer.loadInput(stream);
    }

    /**
     * Consume {@code usetemplate} and {@code \setvar} commands up to the first {@code \frame}.
     */
    public Preamble readPreamble() {
        while (!isPreambleEnd(tokenizer.peekNext())) {
            var token = tokenizer.next();
            if (!token.is(Token.Kind.COMMAND)) {
                throw ParserException.at(token.line(), "missing command");
            }
            preambleCommand(token);
        }
        return preamble;
    }

    private static boolean isPreambleEnd(Token token) {
        return token.isCommand("\\frame") || token.is(Token.Kind.END_OF_FILE);
    }

    private void preambleCommand(Token token) {
        switch (token.text()) {
            case "\\usetemplate" -> {
                var name = tokenizer.next();
                if (!name.is(Token.Kind.TEXT)) {
                    throw ParserException.at(token.line(), "Missing Template name");
                }
                preamble = Preamble.withTemplate(name.text(), token.line());
            }
            case "\\setvar" -> setVariable(token.line());
            default -> throw ParserException.at(token.line(), "missing command");
        }
    }

    /**
     * Parse frames until the end of input.
     */
    public FrameList readInput() {
        var token = tokenizer.next();
        while (!token.is(Token.Kind.END_OF_FILE)) {
            if (!token.is(Token.Kind.COMMAND)) {
                throw ParserException.at(token.line(), "missing command");
            }
            command(token);
            token = tokenizer.next();
        }
        // the last page index, not the page count
        var totalPages = String.valueOf(frames.size() - 1);
        return new FrameList(frames.stream()
                                   .map(draft -> draft.build(totalPages))
                                   .toList());
    }

    private void command(Token token) {
        int line = token.line();
        switch (token.text()) {
            case "\\frame" -> newFrame(line);
            case "\\text" -> newTextField(line);
            case "\\image" -> newImage(line);
            case "\\body" -> newBody(line);
            case "\\title" -> newTitle(line);
            case "\\arrow" -> newArrow(line);
            case "\\line" -> newLine(line);
            case "\\pause" -> pauseCount++;
            case "\\plaintext" -> newPlainText(line);
            case "\\blindtext" -> newBlindText(line);
            case "\\code" -> newCode(line);
            case "\\setvar" -> setVariable(line);
            default -> throw ParserException.at(line, "command does not exist");
        }
    }

    private void newFrame(int line) {
        boxCounter = 0;
        pauseCount = 0;
        var token = tokenizer.next();
        Optional<String> frameClass = Optional.empty();
        if (token.is(Token.Kind.ARGUMENT)) {
            if (!token.text().equals("class")) {
                throw ParserException.at(token.line(), "Only the Argument \"class\" is allowed after frame Command");
            }
            var value = tokenizer.next();
            if (!value.is(Token.Kind.ARGUMENT_VALUE) || value.text().isEmpty()) {
                throw ParserException.at(token.line(), "Argument value is missing");
            }
            frameClass = Optional.of(value.text());
            token = tokenizer.next();
        }
        if (!token.is(Token.Kind.TEXT) || token.text().isEmpty()) {
            throw ParserException.at(line, "missing frame id");
        }
        var id = token.text();
        if (frames.stream().anyMatch(frame -> frame.id.equals(id))) {
            throw ParserException.at(line, "frame id already exist");
        }
        variables.put(Variables.PAGE_NUMBER, String.valueOf(frames.size()));
        variables.putIfAbsent(Variables.DATE, config.currentDate());
        variables.putIfAbsent(Variables.RESOURCE_PATH, config.resourcePath());
        frames.add(new FrameDraft(id, frameClass, variables, line));
    }

    private void newTextField(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var text = readOptionalText(true);
        appendBox(new Box.TextBox(arguments.id(), text, arguments.style(), pauseCount, line));
    }

    private void newPlainText(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var text = readOptionalText(true);
        var style = arguments.style().withBoxClass("body");
        appendBox(new Box.PlainTextBox(arguments.id(), text, style, pauseCount, line));
    }

    private void newCode(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var text = readOptionalText(true);
        appendBox(new Box.CodeBox(arguments.id(), text, arguments.style(), pauseCount, line));
    }

    private void newImage(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var source = readOptionalText(false);
        appendBox(new Box.ImageBox(arguments.id(), source, arguments.style(), pauseCount, line));
    }

    private void newTitle(int line) {
        var arguments = boxArguments(line, Layout.Slot.TITLE);
        var text = currentFrame().id;
        var next = tokenizer.peekNext();
        if (next.is(Token.Kind.TEXT) && !next.text().isEmpty()) {
            text = tokenizer.next().text();
        }
        var style = arguments.style().withBoxClass("title");
        appendBox(new Box.TitleBox(arguments.id(), text, style, pauseCount, line));
    }

    private void newBody(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var text = readOptionalText(true);
        var style = arguments.style().withBoxClass("body");
        appendBox(new Box.TextBox(arguments.id(), text, style, pauseCount, line));
    }

    private void newArrow(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        appendBox(new Box.ArrowBox(arguments.id(), arguments.style(), pauseCount, line));
        requireNoText(line, "\\arrow command need no text");
    }

    private void newLine(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        appendBox(new Box.LineBox(arguments.id(), arguments.style(), pauseCount, line));
        requireNoText(line, "\\line command need no text");
    }

    private void newBlindText(int line) {
        var arguments = boxArguments(line, Layout.Slot.BODY);
        var text = BLIND_TEXT;
        if (tokenizer.peekNext().is(Token.Kind.TEXT)) {
            var lengthToken = tokenizer.next();
            int length = parseInt(lengthToken, "blindtext length");
            if (length >= 0 && length < BLIND_TEXT.length()) {
                text = BLIND_TEXT.substring(0, length);
            }
        }
        var style = arguments.style().withBoxClass("body");
        appendBox(new Box.TextBox(arguments.id(), text, style, pauseCount, line));
    }

    private void setVariable(int line) {
        var token = tokenizer.next();
        if (!token.is(Token.Kind.TEXT)) {
            throw ParserException.at(line, "Missing Variable declaration");
        }
        var declaration = token.text();
        var name = declaration.split("\\s+", 2)[0];
        var value = declaration.substring(name.length()).stripLeading();
        variables.put(Variables.bracket(name), value);
    }

    private BoxArguments boxArguments(int line, Layout.Slot slot) {
        if (frames.isEmpty()) {
            throw ParserException.at(line, MISSING_FRAME);
        }
        var initial = BoxStyle.DEFAULT.withGeometry(config.layout().geometry(slot));
        return readArguments(generateId(), initial);
    }

    private String readOptionalText(boolean allowMultiLine) {
        var next = tokenizer.peekNext();
        if (next.is(Token.Kind.TEXT) || (allowMultiLine && next.is(Token.Kind.MULTI_LINE_TEXT))) {
            return tokenizer.next().text();
        }
        return "";
    }

    private void requireNoText(int line, String message) {
        var next = tokenizer.peekNext();
        if (!next.is(Token.Kind.COMMAND) && !next.is(Token.Kind.END_OF_FILE)) {
            throw ParserException.at(line, message);
        }
    }

    private void appendBox(Box box) {
        currentFrame().boxes.add(box);
        boxCounter++;
    }

    private FrameDraft currentFrame() {
        return frames.get(frames.size() - 1);
    }

    private String generateId() {
        return currentFrame().id + "-intern-" + boxCounter;
    }

    /**
     * Apply {@code name=value} arguments on top of {@code style}. Unknown names are ignored.
     */
    private BoxArguments readArguments(String generatedId, BoxStyle style) {
        var id = generatedId;
        while (tokenizer.peekNext().is(Token.Kind.ARGUMENT)) {
            var argument = tokenizer.next();
            var value = tokenizer.next();
            if (!value.is(Token.Kind.ARGUMENT_VALUE)) {
                throw ParserException.at(argument.line(), "Missing Value in argument");
            }
            var text = value.text();
            var geometry = style.geometry();
            switch (argument.text()) {
                case "color" -> style = style.withColor(text);
                case "opacity" -> style = style.withOpacity(parseDouble(value, "opacity"));
                case "font-size" -> style = style.withFontSize(parseInt(value, "font-size"));
                case "line-height" -> {
                    var spacing = parseDouble(value, "line-height");
                    if (spacing != 0) {
                        style = style.withLineSpacing(spacing);
                    }
                }
                case "font-weight" -> style = style.withFontWeight(fontWeight(value));
                case "font" -> style = style.withFont(text);
                case "id" -> {
                    if (!userIds.add(text)) {
                        throw ParserException.at(value.line(), "Id already exists");
                    }
                    id = text;
                }
                case "left" -> style = style.withGeometry(geometry.withLeft(parseInt(value, "left")));
                case "top" -> style = style.withGeometry(geometry.withTop(parseInt(value, "top")));
                case "width" -> style = style.withGeometry(geometry.withWidth(parseInt(value, "width")));
                case "height" -> style = style.withGeometry(geometry.withHeight(parseInt(value, "height")));
                case "angle" -> style = style.withGeometry(geometry.withAngle(parseDouble(value, "angle")));
                case "text-align" -> style = style.withAlignment(
                    TextAlignment.fromKeyword(text)
                                 .orElseThrow(() -> ParserException.at(value.line(),
                                                                       "possible alignment: left, right, center, justify")));
                case "class" -> style = style.withBoxClass(text);
                case "language" -> style = style.withLanguage(text);
                default -> log.debug("Ignoring unknown argument '{}' on line {}", argument.text(), argument.line() + 1);
            }
        }
        return new BoxArguments(id, style);
    }

    private static FontWeight fontWeight(Token value) {
        return switch (value.text()) {
            case "bold" -> FontWeight.BOLD;
            case "normal" -> FontWeight.NORMAL;
            default -> throw ParserException.at(value.line(), "font-weight can only be bold or normal");
        };
    }

    private static int parseInt(Token value, String name) {
        try {
            return Integer.parseInt(value.text().trim());
        } catch (NumberFormatException e) {
            throw ParserException.at(value.line(), name + " must be an integer");
        }
    }

    private static double parseDouble(Token value, String name) {
        try {
            return Double.parseDouble(value.text().trim());
        } catch (NumberFormatException e) {
            throw ParserException.at(value.line(), name + " must be a number");
        }
    }

    private record BoxArguments(String id, BoxStyle style) {}

    /**
     * Mutable frame under construction; frozen into a {@link Frame} once parsing succeeds.
     */
    private static final class FrameDraft {
        private final String id;
        private final Optional<String> frameClass;
        private final Map<String, String> variables;
        private final List<Box> boxes = new ArrayList<>();
        private final int line;

        FrameDraft(String id, Optional<String> frameClass, Map<String, String> variables, int line) {
            this.id = id;
            this.frameClass = frameClass;
            this.variables = new HashMap<>(variables);
            this.line = line;
        }

        Frame build(String totalPages) {
            var finalVariables = new HashMap<>(variables);
            finalVariables.put(Variables.TOTAL_PAGES, totalPages);
            return new Frame(id, frameClass, boxes, List.of(), finalVariables, line);
        }
    }
}
