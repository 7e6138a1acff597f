package ir.ipaam.layoutservice.domain.text;

/** Ascent above and descent below the baseline, both positive. */
public record LineMetrics(double ascent, double descent) {

    public static final LineMetrics ZERO = new LineMetrics(0, 0);

    public LineMetrics max(LineMetrics other) {
        return new LineMetrics(Math.max(ascent, other.ascent), Math.max(descent, other.descent));
    }

    public double glyphHeight() {
        return ascent + descent;
    }
}
