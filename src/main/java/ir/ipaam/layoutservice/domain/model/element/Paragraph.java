package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.Line;
import ir.ipaam.layoutservice.domain.model.valueobject.PositionedWord;
import ir.ipaam.layoutservice.domain.model.valueobject.Span;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.LineMetrics;
import ir.ipaam.layoutservice.domain.text.StyledWord;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wrapped text made of styled spans.
 *
 * <p>The spans are broken into lines against the area width on every render, and as
 * many lines as fit the remaining height are drawn. The undrawn lines come back as a new
 * paragraph holding their text, so a continuation is broken again against whatever
 * width the next page offers.
 */
public class Paragraph implements Element {

    private static final double EPSILON = 1e-9;
    private static final double UNDERLINE_OFFSET = 0.1;
    private static final double UNDERLINE_THICKNESS = 0.05;
    private static final double STRIKETHROUGH_THICKNESS = 0.3;

    private final List<Span> spans;
    private final Alignment alignment;
    private final Style style;

    public Paragraph(String text) {
        this(List.of(Span.of(text)), Alignment.LEFT, Style.empty());
    }

    public Paragraph(List<Span> spans) {
        this(spans, Alignment.LEFT, Style.empty());
    }

    public Paragraph(List<Span> spans, Alignment alignment, Style style) {
        this.spans = List.copyOf(spans);
        this.alignment = alignment == null ? Alignment.LEFT : alignment;
        this.style = style == null ? Style.empty() : style;
    }

    public Paragraph push(String text) {
        return push(text, Style.empty());
    }

    public Paragraph push(String text, Style spanStyle) {
        List<Span> next = new ArrayList<>(spans);
        next.add(new Span(text, spanStyle));
        return new Paragraph(next, alignment, style);
    }

    public Paragraph aligned(Alignment value) {
        return new Paragraph(spans, value, style);
    }

    public Paragraph withStyle(Style value) {
        return new Paragraph(spans, alignment, value);
    }

    public List<Span> getSpans() {
        return spans;
    }

    public Alignment getAlignment() {
        return alignment;
    }

    public Style getStyle() {
        return style;
    }

    public String text() {
        return spans.stream().map(Span::text).collect(Collectors.joining());
    }

    /** Breaks the paragraph into lines for the given width without drawing anything. */
    public List<Line> lines(RenderContext context, double width, Style inherited) {
        Style base = Style.merge(inherited, style);
        List<Span> merged = spans.stream()
                .map(span -> new Span(span.text(), Style.merge(base, span.style())))
                .toList();
        List<StyledWord> words = context.getWordSplitter().split(merged);
        return context.getLineBreaker().breakLines(words, width);
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style inherited) {
        List<Line> lines = lines(context, area.getWidth(), inherited);
        if (lines.isEmpty()) {
            return RenderResult.done(0);
        }

        double remaining = area.getRemainingHeight();
        double used = 0;
        int drawn = 0;
        for (Line line : lines) {
            if (used + line.height() > remaining + EPSILON) {
                if (drawn > 0 || !area.isPageBlank()) {
                    break;
                }
                context.reportOverflow("line of height " + line.height() + "pt exceeds the "
                        + remaining + "pt left on an empty page");
            }
            if (line.overflow()) {
                context.reportOverflow("\"" + line.text().strip() + "\" is wider than "
                        + area.getWidth() + "pt");
            }
            drawLine(context, area, line, used);
            used += line.height();
            drawn++;
        }

        double consumed = Math.min(used, remaining);
        if (drawn == lines.size()) {
            return RenderResult.done(consumed);
        }
        if (drawn == 0) {
            return RenderResult.nothingFits(this);
        }
        return RenderResult.partial(consumed, remainderOf(lines.subList(drawn, lines.size())));
    }

    private Paragraph remainderOf(List<Line> rest) {
        List<Span> tail = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        Style current = null;
        for (Line line : rest) {
            for (PositionedWord word : line.words()) {
                if (current != null && !current.equals(word.style())) {
                    tail.add(new Span(text.toString(), current));
                    text.setLength(0);
                }
                current = word.style();
                text.append(word.sourceText());
            }
        }
        if (current != null) {
            tail.add(new Span(text.toString(), current));
        }
        return new Paragraph(tail, alignment, Style.empty());
    }

    private void drawLine(RenderContext context, Area area, Line line, double top) {
        TextMeasurer measurer = context.getMeasurer();
        double baseline = top + line.baseline();
        boolean justify = alignment == Alignment.JUSTIFIED && !line.hardBreak() && !line.overflow()
                && line.stretchableGaps() > 0;
        double offset = justify ? 0 : Math.max(0, alignment.offset(line.width(), area.getWidth()));
        double gapStretch = justify ? (area.getWidth() - line.width()) / line.stretchableGaps() : 0;

        List<PositionedWord> words = line.words();
        double shift = 0;
        int runStart = 0;
        for (int i = 0; i < words.size(); i++) {
            PositionedWord word = words.get(i);
            boolean endOfRun = i == words.size() - 1
                    || justify
                    || !words.get(i + 1).style().equals(word.style());
            if (!endOfRun) {
                continue;
            }
            List<PositionedWord> run = words.subList(runStart, i + 1);
            drawRun(measurer, area, run, offset + shift, baseline);
            if (justify && endsWithSpace(word)) {
                shift += gapStretch;
            }
            runStart = i + 1;
        }
    }

    private void drawRun(TextMeasurer measurer, Area area, List<PositionedWord> run, double shift, double baseline) {
        String text = run.stream().map(PositionedWord::text).collect(Collectors.joining());
        if (text.isBlank()) {
            return;
        }
        PositionedWord first = run.get(0);
        PositionedWord last = run.get(run.size() - 1);
        Style runStyle = first.style();
        double x = first.x() + shift;
        area.drawText(x, baseline, text, measurer.font(runStyle), runStyle);
        double width = last.x() + last.width() - first.x();
        if (runStyle.isUnderline()) {
            double size = runStyle.resolvedFontSize();
            area.drawRect(x, baseline + size * UNDERLINE_OFFSET, width,
                    size * UNDERLINE_THICKNESS, runStyle.resolvedColor());
        }
        if (runStyle.isStrikethrough()) {
            // through the middle of the glyph box
            LineMetrics metrics = measurer.lineMetrics(runStyle);
            double middle = baseline - (metrics.ascent() - metrics.descent()) / 2;
            area.drawRect(x, middle - STRIKETHROUGH_THICKNESS / 2, width,
                    STRIKETHROUGH_THICKNESS, runStyle.resolvedColor());
        }
    }

    private static boolean endsWithSpace(PositionedWord word) {
        String t = word.text();
        return !t.isEmpty() && Character.isWhitespace(t.charAt(t.length() - 1));
    }

    @Override
    public String toString() {
        String text = text();
        return "Paragraph[" + (text.length() > 40 ? text.substring(0, 40) + "..." : text) + "]";
    }
}
