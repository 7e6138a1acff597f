package ir.ipaam.layoutservice.domain.text;

import ir.ipaam.layoutservice.domain.model.valueobject.Line;
import ir.ipaam.layoutservice.domain.model.valueobject.PositionedWord;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Greedy line filling. Words are taken left to right until the next one no longer fits;
 * a word that does not fit is hyphenated into the remaining width when the hyphenator
 * offers a break point, otherwise it starts the next line. A word that is too wide even
 * for an empty line is emitted alone on a line flagged as overflowing.
 *
 * <p>A hyphenated head whose width (hyphen included) equals the available width exactly
 * is accepted on the current line.
 */
@Slf4j
public class LineBreaker {

    static final double EPSILON = 1e-9;
    private static final String HYPHEN = "-";

    private final TextMeasurer measurer;

    public LineBreaker(TextMeasurer measurer) {
        this.measurer = measurer;
    }

    public TextMeasurer getMeasurer() {
        return measurer;
    }

    public List<Line> breakLines(List<StyledWord> words, double maxWidth) {
        List<Line> lines = new ArrayList<>();
        Deque<StyledWord> pending = new ArrayDeque<>(words);
        LineBuilder line = new LineBuilder();

        while (!pending.isEmpty()) {
            StyledWord word = pending.pollFirst();
            String visible = word.withoutTrailingWhitespace();
            double visibleWidth = measurer.measure(visible, word.style());

            if (line.advance + visibleWidth <= maxWidth + EPSILON) {
                line.add(word.text(), word.text(), word.style(), visibleWidth, measurer.measure(word.text(), word.style()));
                if (word.endsLine()) {
                    lines.add(line.build(true, false, false));
                    line = new LineBuilder();
                }
                continue;
            }

            int split = bestHyphenation(visible, word.style(), maxWidth - line.advance);
            if (split > 0) {
                String head = word.text().substring(0, split);
                String drawn = head + HYPHEN;
                double drawnWidth = measurer.measure(drawn, word.style());
                line.add(drawn, head, word.style(), drawnWidth, drawnWidth);
                lines.add(line.build(false, true, false));
                line = new LineBuilder();
                pending.addFirst(new StyledWord(word.text().substring(split), word.style()));
                continue;
            }

            if (!line.isEmpty()) {
                lines.add(line.build(false, false, false));
                line = new LineBuilder();
                pending.addFirst(word);
                continue;
            }

            log.debug("Word \"{}\" ({}pt) exceeds line width {}pt", visible, visibleWidth, maxWidth);
            line.add(word.text(), word.text(), word.style(), visibleWidth, measurer.measure(word.text(), word.style()));
            lines.add(line.build(word.endsLine(), false, true));
            line = new LineBuilder();
        }
        if (!line.isEmpty()) {
            lines.add(line.build(true, false, false));
        }
        return lines;
    }

    /**
     * Largest candidate offset whose head plus hyphen fits {@code available}, or -1.
     */
    private int bestHyphenation(String visible, Style style, double available) {
        if (available <= 0 || !measurer.isHyphenationEnabled()) {
            return -1;
        }
        List<Integer> candidates = measurer.breakCandidates(visible);
        for (int i = candidates.size() - 1; i >= 0; i--) {
            int offset = candidates.get(i);
            double width = measurer.measure(visible.substring(0, offset) + HYPHEN, style);
            if (width <= available + EPSILON) {
                return offset;
            }
        }
        return -1;
    }

    private final class LineBuilder {
        private final List<PositionedWord> words = new ArrayList<>();
        private double advance;
        private double visibleEnd;

        boolean isEmpty() {
            return words.isEmpty();
        }

        void add(String text, String source, Style style, double width, double wordAdvance) {
            words.add(new PositionedWord(drawable(text), source, style, advance, width, wordAdvance));
            if (!text.isBlank()) {
                visibleEnd = advance + width;
            }
            advance += wordAdvance;
        }

        Line build(boolean hardBreak, boolean hyphenated, boolean overflow) {
            double ascent = 0;
            double descent = 0;
            double height = 0;
            for (PositionedWord word : words) {
                LineMetrics metrics = measurer.lineMetrics(word.style());
                ascent = Math.max(ascent, metrics.ascent());
                descent = Math.max(descent, metrics.descent());
                height = Math.max(height, measurer.lineHeight(word.style()));
            }
            return new Line(words, visibleEnd, ascent, descent, height, hyphenated, hardBreak, overflow);
        }
    }

    private static String drawable(String text) {
        return text.replace("\r", "").replace("\n", "").replace("\u2028", "");
    }
}
