package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;

/** Merges a style over the inherited one for a whole subtree. */
@Getter
public class StyledElement implements Element {

    private final Element element;
    private final Style style;

    public StyledElement(Element element, Style style) {
        this.element = element;
        this.style = style == null ? Style.empty() : style;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style inherited) {
        RenderResult result = element.render(context, area, Style.merge(inherited, style));
        if (result.isDone()) {
            return result;
        }
        if (result.getRemainder() == element && result.getHeight() == 0 && !result.isPageBreak()) {
            return RenderResult.nothingFits(this);
        }
        StyledElement rest = new StyledElement(result.getRemainder(), style);
        return result.isPageBreak()
                ? RenderResult.pageBreak(result.getHeight(), rest)
                : RenderResult.partial(result.getHeight(), rest);
    }
}
