package org.pragmatica.slides.tools;

import org.pragmatica.slides.CompileResult;
import org.pragmatica.slides.SlideCompiler;
import org.pragmatica.slides.render.RenderPlan;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line checker: compiles a markup file and reports the result.
 *
 * <pre>
 * slidecheck talk.slides
 * </pre>
 * Exit code 0 on success, 1 on a compile error, 2 on usage or I/O problems.
 */
public final class SlideCheck {
    private SlideCheck() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: slidecheck <input file>");
            return 2;
        }
        var input = Path.of(args[0]);
        if (!Files.isRegularFile(input)) {
            err.println("Error: Input file not found: " + input);
            return 2;
        }

        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Could not read file: " + input + " (" + e.getMessage() + ")");
            return 2;
        }

        var directory = input.toAbsolutePath().getParent();
        var compiler = SlideCompiler.builder()
                                    .resourcePath(directory == null ? "." : directory.toString())
                                    .build();
        var result = compiler.compile(source);
        if (result instanceof CompileResult.Failure failure) {
            err.print(failure.diagnostic().format(source, input.getFileName().toString()));
            return 1;
        }

        var frames = ((CompileResult.Success) result).frames();
        int pages = frames.stream()
                          .mapToInt(RenderPlan::pauseCount)
                          .sum();
        out.println(result.statusMessage() + ": " + frames.size() + " frames, " + pages + " pages");
        return 0;
    }
}
