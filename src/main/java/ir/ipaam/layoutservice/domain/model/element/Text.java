package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.LineMetrics;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;
import lombok.Getter;

/**
 * A single line of text that is never wrapped. Too wide for the area it is drawn
 * anyway and reported; too tall for what is left of the page it moves on whole.
 */
@Getter
public class Text implements Element {

    private final String text;
    private final Style style;
    private final Alignment alignment;

    public Text(String text) {
        this(text, Style.empty(), Alignment.LEFT);
    }

    public Text(String text, Style style) {
        this(text, style, Alignment.LEFT);
    }

    public Text(String text, Style style, Alignment alignment) {
        this.text = text;
        this.style = style == null ? Style.empty() : style;
        this.alignment = alignment == null ? Alignment.LEFT : alignment;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style inherited) {
        Style merged = Style.merge(inherited, style);
        TextMeasurer measurer = context.getMeasurer();
        double height = measurer.lineHeight(merged);
        double remaining = area.getRemainingHeight();
        if (height > remaining) {
            if (!area.isPageBlank()) {
                return RenderResult.nothingFits(this);
            }
            context.reportOverflow("text \"" + text + "\" is taller than the empty page");
        }
        double width = measurer.measure(text, merged);
        if (width > area.getWidth()) {
            context.reportOverflow("text \"" + text + "\" is wider than " + area.getWidth() + "pt");
        }
        LineMetrics metrics = measurer.lineMetrics(merged);
        double baseline = (height - metrics.glyphHeight()) / 2 + metrics.ascent();
        double x = Math.max(0, alignment.offset(width, area.getWidth()));
        if (!text.isEmpty()) {
            area.drawText(x, baseline, text, measurer.font(merged), merged);
        }
        return RenderResult.done(Math.min(height, remaining));
    }
}
