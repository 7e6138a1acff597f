package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

/**
 * A node of the content tree.
 *
 * <p>{@link #render} draws as much of the element as fits into {@code area} and reports
 * the height it used, never more than the area's remaining height. An element that does
 * not finish returns a new element holding the rest; it never changes itself. The area
 * belongs to the call: implementations may consume it freely.
 */
public interface Element {

    RenderResult render(RenderContext context, Area area, Style style);

    default Element styled(Style style) {
        return new StyledElement(this, style);
    }

    default Element padded(Margins padding) {
        return new PaddedElement(this, padding);
    }

    default Element padded(double padding) {
        return new PaddedElement(this, Margins.all(padding));
    }

    default Element framed() {
        return new FramedElement(this, LineStyle.DEFAULT);
    }

    default Element framed(LineStyle lineStyle) {
        return new FramedElement(this, lineStyle);
    }
}
