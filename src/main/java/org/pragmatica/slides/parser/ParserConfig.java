package org.pragmatica.slides.parser;

import org.pragmatica.slides.model.Layout;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Parser configuration options.
 *
 * @param resourcePath value of {@code %{resourcepath}}, usually the directory of the input file
 * @param clock        source of {@code %{date}}
 * @param datePattern  {@link DateTimeFormatter} pattern for {@code %{date}}
 * @param layout       canvas layout supplying default box geometry
 */
public record ParserConfig(
    String resourcePath,
    Clock clock,
    String datePattern,
    Layout layout
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        ".",
        Clock.systemDefaultZone(),
        "EEE MMM d yyyy",
        Layout.SIXTEEN_TO_NINE
    );

    public String currentDate() {
        return LocalDate.now(clock)
                        .format(DateTimeFormatter.ofPattern(datePattern, Locale.ENGLISH));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String resourcePath = DEFAULT.resourcePath();
        private Clock clock = DEFAULT.clock();
        private String datePattern = DEFAULT.datePattern();
        private Layout layout = DEFAULT.layout();

        private Builder() {}

        public Builder resourcePath(String resourcePath) {
            this.resourcePath = resourcePath;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder datePattern(String datePattern) {
            this.datePattern = datePattern;
            return this;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(resourcePath, clock, datePattern, layout);
        }
    }
}
