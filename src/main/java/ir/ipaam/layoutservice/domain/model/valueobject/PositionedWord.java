package ir.ipaam.layoutservice.domain.model.valueobject;

/**
 * A word placed on a line.
 *
 * @param text       what gets drawn, including a trailing hyphen when the word was split
 * @param sourceText the slice of the original text this word covers, without any added hyphen
 * @param style      the fully merged style of the word
 * @param x          offset from the start of the line
 * @param width      measured width of the visible part (trailing whitespace excluded)
 * @param advance    measured width including trailing whitespace
 */
public record PositionedWord(String text, String sourceText, Style style, double x, double width, double advance) {

    public PositionedWord withX(double newX) {
        return new PositionedWord(text, sourceText, style, newX, width, advance);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
