package org.pragmatica.slides.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_error_showsContextAndUnderline() {
        var source = "\\frame a\n\\frame a";
        var diagnostic = Diagnostic.error(ParserError.at(1, "frame id already exist"));

        var expected = """
            error: frame id already exist
              --> talk.slides:2
              |
            1 | \\frame a
            2 | \\frame a
              | ^^^^^^^^
              |
            """;
        assertEquals(expected, diagnostic.format(source, "talk.slides"));
    }

    @Test
    void format_withHelp_appendsNote() {
        var diagnostic = Diagnostic.error(ParserError.at(0, "missing frame id"))
                                   .withHelp("every \\frame needs an id");

        var formatted = diagnostic.format("\\frame", null);

        assertThat(formatted).contains("  --> 1\n")
                             .endsWith("  = help: every \\frame needs an id\n");
    }

    @Test
    void format_indentedLine_underlinesTrimmedContent() {
        var diagnostic = Diagnostic.warning("odd", 0);

        var formatted = diagnostic.format("    \\pause  ", "x");

        assertThat(formatted).startsWith("warning: odd")
                             .contains("  |     ^^^^^^\n");
    }

    @Test
    void format_windowsLineEndings_areNotPrinted() {
        var diagnostic = Diagnostic.error(ParserError.at(0, "missing command"));

        var formatted = diagnostic.format("stray\r\n\\frame a", "x");

        assertThat(formatted).contains("1 | stray\n")
                             .doesNotContain("\r");
    }

    @Test
    void format_lineBeyondSource_keepsHeader() {
        var diagnostic = Diagnostic.error(ParserError.at(5, "Template not found: x"));

        var formatted = diagnostic.format("\\frame a", "x");

        assertThat(formatted).startsWith("error: Template not found: x\n  --> x:6\n");
    }

    @Test
    void formatSimple_usesOneBasedLine() {
        var diagnostic = Diagnostic.error(ParserError.at(3, "command does not exist"));

        assertEquals("input:4: error: command does not exist", diagnostic.formatSimple());
    }

    @Test
    void parserError_toString_isStatusLine() {
        assertEquals("Line 1: missing command", ParserError.at(0, "missing command").toString());
    }
}
