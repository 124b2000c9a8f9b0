package org.pragmatica.slides;

import org.junit.jupiter.api.Test;
import org.pragmatica.slides.model.Box;
import org.pragmatica.slides.model.Template;
import org.pragmatica.slides.model.Variables;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SlideCompilerTest {

    private static CompileResult.Success success(CompileResult result) {
        assertTrue(result.isSuccess(), () -> "Compile failed: " + result.statusMessage());
        return (CompileResult.Success) result;
    }

    private static CompileResult.Failure failure(CompileResult result) {
        assertTrue(result.isFailure(), "Expected a failed compile");
        return (CompileResult.Failure) result;
    }

    @Test
    void compile_validDocument_succeeds() {
        var result = SlideCompiler.create().compile("""
            \\frame intro
            \\title Welcome
            \\text Hello
            """);

        var frames = success(result).frames();
        assertEquals(1, frames.size());
        assertEquals(2, frames.get(0).boxes().size());
        assertEquals("Conversion succeeded", result.statusMessage());
    }

    @Test
    void compile_error_reportsOneBasedLineInStatus() {
        var result = SlideCompiler.create().compile("\\frame a\n\\frame a");

        var error = failure(result).error();
        assertEquals(1, error.line());
        assertEquals("Line 2: frame id already exist", result.statusMessage());
    }

    @Test
    void compile_emptyDocument_succeedsWithoutFrames() {
        var result = SlideCompiler.create().compile("");

        assertTrue(success(result).frames().isEmpty());
    }

    @Test
    void compile_calledTwice_usesFreshParser() {
        var compiler = SlideCompiler.create();
        var text = "\\frame a\n\\text id=unique hi";

        assertTrue(compiler.compile(text).isSuccess());
        assertTrue(compiler.compile(text).isSuccess());
    }

    @Test
    void compile_fixedClock_injectsDate() {
        var compiler = SlideCompiler.builder()
                                    .clock(Clock.fixed(Instant.parse("2023-12-24T08:00:00Z"), ZoneOffset.UTC))
                                    .datePattern("yyyy-MM-dd")
                                    .resourcePath("/res")
                                    .build();

        var frame = success(compiler.compile("\\frame a")).frames().get(0);

        assertEquals("2023-12-24", frame.variable(Variables.DATE).orElseThrow());
        assertEquals("/res", frame.variable(Variables.RESOURCE_PATH).orElseThrow());
    }

    @Test
    void compile_withTemplate_borrowsBoxesByFrameClass() {
        var templateFrames = success(SlideCompiler.create().compile("""
            \\frame section
            \\text id=footer %{pagenumber} / %{totalpages}
            \\frame other
            \\line
            """)).frames();
        var template = new Template("corporate", templateFrames);
        var compiler = SlideCompiler.builder()
                                    .templates(name -> name.equals("corporate") ? Optional.of(template) : Optional.empty())
                                    .build();

        var result = success(compiler.compile("""
            \\usetemplate corporate
            \\frame class=section first
            \\text body
            \\frame plain
            """));

        assertEquals("corporate", result.preamble().templateName().orElseThrow());
        assertThat(result.frames().get(0).templateBoxes()).extracting(Box::id).containsExactly("footer");
        assertTrue(result.frames().get(1).templateBoxes().isEmpty());
    }

    @Test
    void compile_unknownTemplate_fails() {
        var result = SlideCompiler.create().compile("\n\\usetemplate missing\n\\frame a");

        var error = failure(result).error();
        assertEquals("Template not found: missing", error.message());
        assertEquals(1, error.line());
    }

    @Test
    void compile_stream_decodesUtf8() throws IOException {
        var bytes = "\\frame ünïcode".getBytes(StandardCharsets.UTF_8);

        var result = SlideCompiler.create().compile(new ByteArrayInputStream(bytes));

        assertEquals("ünïcode", success(result).frames().get(0).id());
    }

    @Test
    void failure_diagnostic_pointsAtOffendingLine() {
        var source = "\\frame a\n\\text font-weight=heavy hi";
        var result = failure(SlideCompiler.create().compile(source));

        var formatted = result.diagnostic().format(source, "talk.slides");

        assertThat(formatted).contains("error: font-weight can only be bold or normal")
                             .contains("--> talk.slides:2")
                             .contains("2 | \\text font-weight=heavy hi");
    }
}
