package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.valueobject.Style;

/**
 * Prepares every freshly allocated page, for example by drawing a header, and returns
 * the area left for the document body.
 */
@FunctionalInterface
public interface PageDecorator {

    Area decorate(RenderContext context, Area pageArea, Style style, int pageNumber);
}
