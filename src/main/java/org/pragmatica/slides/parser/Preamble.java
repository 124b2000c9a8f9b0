package org.pragmatica.slides.parser;

import java.util.Optional;

/**
 * Settings read before the first {@code \frame}.
 *
 * @param templateName name given to {@code usetemplate}, if any
 * @param templateLine 0-based line of the {@code usetemplate} command, -1 without one
 */
public record Preamble(Optional<String> templateName, int templateLine) {

    public static final Preamble NONE = new Preamble(Optional.empty(), -1);

    public static Preamble withTemplate(String name, int line) {
        return new Preamble(Optional.of(name), line);
    }
}
