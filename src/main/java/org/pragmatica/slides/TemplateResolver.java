package org.pragmatica.slides;

import org.pragmatica.slides.model.Template;

import java.util.Optional;

/**
 * Looks up a compiled template by the name given to {@code usetemplate}.
 * Locating and compiling the template file is up to the implementation.
 */
@FunctionalInterface
public interface TemplateResolver {

    TemplateResolver NONE = name -> Optional.empty();

    Optional<Template> resolve(String name);
}
