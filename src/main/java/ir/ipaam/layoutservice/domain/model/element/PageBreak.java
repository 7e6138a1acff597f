package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

/** Ends the current page, whatever space is left on it. */
public final class PageBreak implements Element {

    public static final PageBreak INSTANCE = new PageBreak();

    private PageBreak() {
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        return RenderResult.pageBreak(0);
    }

    @Override
    public String toString() {
        return "PageBreak";
    }
}
