package org.pragmatica.slides.render;

import org.junit.jupiter.api.Test;
import org.pragmatica.slides.CompileResult;
import org.pragmatica.slides.SlideCompiler;
import org.pragmatica.slides.model.Frame;
import org.pragmatica.slides.model.FrameList;
import org.pragmatica.slides.model.Template;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RenderPlanTest {

    private static FrameList compile(String source) {
        return ((CompileResult.Success) SlideCompiler.builder()
                                                     .resourcePath("/res")
                                                     .build()
                                                     .compile(source)).frames();
    }

    private static final Frame FRAME = compile("""
        \\frame a
        \\title Page %{pagenumber} of %{totalpages}
        \\pause
        \\image %{resourcepath}/logo.png
        \\arrow
        \\pause
        \\text %{unknown} stays
        \\frame b
        """).get(0);

    @Test
    void of_fullFrame_substitutesVariables() {
        var plan = RenderPlan.of(FRAME);

        assertThat(plan.items()).extracting(RenderPlan.Item::content).containsExactly(
            Optional.of("Page 0 of 1"),
            Optional.of("/res/logo.png"),
            Optional.empty(),
            Optional.of("%{unknown} stays"));
    }

    @Test
    void of_revealCount_skipsLaterBoxes() {
        assertEquals(1, RenderPlan.of(FRAME, 0).items().size());
        assertEquals(3, RenderPlan.of(FRAME, 1).items().size());
        assertEquals(4, RenderPlan.of(FRAME, 2).items().size());
    }

    @Test
    void pauseCount_isHighestCounterPlusOne() {
        assertEquals(3, RenderPlan.pauseCount(FRAME));
    }

    @Test
    void pauseCount_emptyFrame_isOne() {
        var empty = compile("\\frame lonely").get(0);

        assertEquals(1, RenderPlan.pauseCount(empty));
        assertTrue(RenderPlan.of(empty).items().isEmpty());
    }

    @Test
    void of_templateBoxes_comeFirstAndAlwaysShow() {
        var template = new Template("t", compile("\\frame section\n\\text id=footer %{pagenumber}"));
        var frame = template.applyTo(compile("""
            \\frame class=section s1
            \\frame class=section s2
            \\pause
            \\text later
            """)).get(1);

        var plan = RenderPlan.of(frame, 0);

        assertEquals(1, plan.items().size());
        assertTrue(plan.items().get(0).fromTemplate());
        assertEquals("1", plan.items().get(0).content().orElseThrow());
        assertFalse(RenderPlan.of(frame).items().get(1).fromTemplate());
    }
}
