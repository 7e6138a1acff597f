package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;

import java.util.List;

/**
 * Draws a frame around its child. When the child continues on the next page the frame
 * stays open at the bottom, and the continuation is drawn without a top edge.
 */
@Getter
public class FramedElement implements Element {

    private final Element element;
    private final LineStyle lineStyle;
    private final boolean first;

    public FramedElement(Element element, LineStyle lineStyle) {
        this(element, lineStyle, true);
    }

    private FramedElement(Element element, LineStyle lineStyle, boolean first) {
        this.element = element;
        this.lineStyle = lineStyle;
        this.first = first;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        double t = lineStyle.thickness();
        double top = first ? t : 0;
        Area inner = area.inset(new Margins(top, t, t, t));
        RenderResult result = element.render(context, inner, style);
        if (result.isPartial() && result.getRemainder() == element
                && result.getHeight() == 0 && !result.isPageBreak()) {
            return RenderResult.nothingFits(this);
        }

        double height = Math.min(area.getRemainingHeight(),
                top + result.getHeight() + (result.isDone() ? t : 0));
        double half = t / 2;
        double left = half;
        double right = area.getWidth() - half;
        area.drawLine(List.of(new Point(left, 0), new Point(left, height)), lineStyle);
        area.drawLine(List.of(new Point(right, 0), new Point(right, height)), lineStyle);
        if (first) {
            area.drawLine(List.of(new Point(0, half), new Point(area.getWidth(), half)), lineStyle);
        }
        if (result.isDone()) {
            area.drawLine(List.of(new Point(0, height - half), new Point(area.getWidth(), height - half)), lineStyle);
            return result.isPageBreak() ? RenderResult.pageBreak(height) : RenderResult.done(height);
        }
        FramedElement rest = new FramedElement(result.getRemainder(), lineStyle, false);
        return result.isPageBreak()
                ? RenderResult.pageBreak(height, rest)
                : RenderResult.partial(height, rest);
    }
}
