package ir.ipaam.layoutservice.domain.text;

import ir.ipaam.layoutservice.domain.model.valueobject.Style;

/**
 * A line-breaking unit: a word with the whitespace that follows it.
 */
public record StyledWord(String text, Style style) {

    public String visibleText() {
        return text.strip();
    }

    /** Leading whitespace is kept, only the trailing part is dropped. */
    public String withoutTrailingWhitespace() {
        return text.stripTrailing();
    }

    /** True when the word ends in a mandatory line break. */
    public boolean endsLine() {
        return text.endsWith("\n") || text.endsWith("\r") || text.endsWith("\u2028");
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
