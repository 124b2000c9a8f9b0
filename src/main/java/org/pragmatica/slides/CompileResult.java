package org.pragmatica.slides;

import org.pragmatica.slides.error.Diagnostic;
import org.pragmatica.slides.error.ParserError;
import org.pragmatica.slides.model.FrameList;
import org.pragmatica.slides.parser.Preamble;

/**
 * Outcome of one compile: either the complete document or the first error, never both.
 */
public sealed interface CompileResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Banner text for the editor status line.
     */
    String statusMessage();

    /**
     * Successful compile with the document and its preamble.
     */
    record Success(FrameList frames, Preamble preamble) implements CompileResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String statusMessage() {
            return "Conversion succeeded";
        }
    }

    /**
     * Failed compile; no document is produced.
     */
    record Failure(ParserError error) implements CompileResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String statusMessage() {
            return error.toString();
        }

        public Diagnostic diagnostic() {
            return Diagnostic.error(error);
        }
    }
}
