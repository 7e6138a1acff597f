package ir.ipaam.layoutservice.domain.model.valueobject;

import java.util.Objects;

/** A run of text sharing one style. */
public record Span(String text, Style style) {

    public Span {
        Objects.requireNonNull(text, "text");
        style = style == null ? Style.empty() : style;
    }

    public static Span of(String text) {
        return new Span(text, Style.empty());
    }
}
