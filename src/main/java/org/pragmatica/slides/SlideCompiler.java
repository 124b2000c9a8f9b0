package org.pragmatica.slides;

import org.pragmatica.slides.error.ParserError;
import org.pragmatica.slides.error.ParserException;
import org.pragmatica.slides.model.FrameList;
import org.pragmatica.slides.model.Layout;
import org.pragmatica.slides.parser.ParserConfig;
import org.pragmatica.slides.parser.SlideParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Entry point: compiles slide markup into a {@link FrameList}.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = SlideCompiler.create().compile("""
 *     \\frame intro
 *     \\title Welcome
 *     \\text Hello %{date}
 *     """);
 * if (result instanceof CompileResult.Success success) {
 *     presentation.setFrames(success.frames());
 * }
 * }</pre>
 */
public final class SlideCompiler {
    private static final Logger log = LoggerFactory.getLogger(SlideCompiler.class);

    private final ParserConfig config;
    private final TemplateResolver templateResolver;

    private SlideCompiler(ParserConfig config, TemplateResolver templateResolver) {
        this.config = config;
        this.templateResolver = templateResolver;
    }

    public static SlideCompiler create() {
        return new SlideCompiler(ParserConfig.DEFAULT, TemplateResolver.NONE);
    }

    public static SlideCompiler create(ParserConfig config, TemplateResolver templateResolver) {
        return new SlideCompiler(config, templateResolver);
    }

    /**
     * Compile a whole document. Each call runs a fresh parser.
     */
    public CompileResult compile(String text) {
        var parser = new SlideParser(config);
        parser.loadInput(text);
        try {
            var preamble = parser.readPreamble();
            var frames = parser.readInput();
            if (preamble.templateName().isPresent()) {
                var name = preamble.templateName().get();
                var template = templateResolver.resolve(name);
                if (template.isEmpty()) {
                    log.warn("Template '{}' could not be resolved", name);
                    return new CompileResult.Failure(ParserError.at(preamble.templateLine(),
                                                                    "Template not found: " + name));
                }
                frames = template.get().applyTo(frames);
            }
            log.debug("Compiled {} frames", frames.size());
            return new CompileResult.Success(frames, preamble);
        } catch (ParserException e) {
            log.debug("Compile failed: {}", e.error());
            return new CompileResult.Failure(e.error());
        }
    }

    public CompileResult compile(InputStream stream) throws IOException {
        return compile(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final ParserConfig.Builder config = ParserConfig.builder();
        private TemplateResolver templateResolver = TemplateResolver.NONE;

        private Builder() {}

        public Builder resourcePath(String resourcePath) {
            config.resourcePath(resourcePath);
            return this;
        }

        public Builder clock(Clock clock) {
            config.clock(clock);
            return this;
        }

        public Builder datePattern(String datePattern) {
            config.datePattern(datePattern);
            return this;
        }

        public Builder layout(Layout layout) {
            config.layout(layout);
            return this;
        }

        public Builder templates(TemplateResolver resolver) {
            this.templateResolver = resolver;
            return this;
        }

        public SlideCompiler build() {
            return new SlideCompiler(config.build(), templateResolver);
        }
    }
}
