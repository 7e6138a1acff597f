package ir.ipaam.layoutservice.domain.model.valueobject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One line produced by the line breaker. {@code width} excludes trailing whitespace.
 * {@code overflow} marks a line wider than the width it was broken against.
 */
public record Line(List<PositionedWord> words,
                   double width,
                   double ascent,
                   double descent,
                   double height,
                   boolean hyphenated,
                   boolean hardBreak,
                   boolean overflow) {

    public Line {
        words = List.copyOf(words);
    }

    /** Baseline offset from the top of the line box; extra leading is split above and below. */
    public double baseline() {
        return (height - ascent - descent) / 2.0 + ascent;
    }

    public String text() {
        return words.stream().map(PositionedWord::text).collect(Collectors.joining());
    }

    public String sourceText() {
        return words.stream().map(PositionedWord::sourceText).collect(Collectors.joining());
    }

    /** Number of gaps that justification may stretch. */
    public int stretchableGaps() {
        int gaps = 0;
        for (int i = 0; i < words.size() - 1; i++) {
            String t = words.get(i).text();
            if (!t.isEmpty() && Character.isWhitespace(t.charAt(t.length() - 1))) {
                gaps++;
            }
        }
        return gaps;
    }
}
