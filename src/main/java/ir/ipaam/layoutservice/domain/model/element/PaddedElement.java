package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;

/**
 * Insets its child. Top padding is applied on every page the child spans, bottom
 * padding only after the child is done.
 */
@Getter
public class PaddedElement implements Element {

    private final Element element;
    private final Margins padding;

    public PaddedElement(Element element, Margins padding) {
        this.element = element;
        this.padding = padding;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        Area inner = area.inset(padding.withBottom(0));
        RenderResult result = element.render(context, inner, style);
        double remaining = area.getRemainingHeight();
        if (result.isDone()) {
            double height = Math.min(remaining, padding.top() + result.getHeight() + padding.bottom());
            return result.isPageBreak() ? RenderResult.pageBreak(height) : RenderResult.done(height);
        }
        if (result.getRemainder() == element && result.getHeight() == 0 && !result.isPageBreak()) {
            return RenderResult.nothingFits(this);
        }
        double height = Math.min(remaining, padding.top() + result.getHeight());
        PaddedElement rest = new PaddedElement(result.getRemainder(), padding);
        return result.isPageBreak()
                ? RenderResult.pageBreak(height, rest)
                : RenderResult.partial(height, rest);
    }
}
