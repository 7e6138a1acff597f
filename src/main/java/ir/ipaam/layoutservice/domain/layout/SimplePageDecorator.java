package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.element.Element;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;
import lombok.extern.slf4j.Slf4j;

/**
 * Draws an optional header element at the top of every page and an optional centered
 * "page N" footer at the bottom.
 */
@Slf4j
public class SimplePageDecorator implements PageDecorator {

    private static final double GAP = 6;

    private final Element header;
    private final boolean pageNumbers;

    public SimplePageDecorator(Element header, boolean pageNumbers) {
        this.header = header;
        this.pageNumbers = pageNumbers;
    }

    public static SimplePageDecorator pageNumbers() {
        return new SimplePageDecorator(null, true);
    }

    @Override
    public Area decorate(RenderContext context, Area pageArea, Style style, int pageNumber) {
        Area body = pageArea.copy();
        if (header != null) {
            RenderResult result = header.render(context, body.copy(), style);
            if (result.isPartial()) {
                log.debug("Header does not fit on page {} and was cut", pageNumber);
            }
            body.consume(result.getHeight() + GAP);
        }
        if (pageNumbers) {
            TextMeasurer measurer = context.getMeasurer();
            String label = "page " + pageNumber;
            double lineHeight = measurer.lineHeight(style);
            double labelWidth = measurer.measure(label, style);
            double top = body.getRemainingHeight() - lineHeight;
            if (top > 0) {
                double ascent = measurer.lineMetrics(style).ascent();
                body.drawText((body.getWidth() - labelWidth) / 2, top + ascent, label, measurer.font(style), style);
                body = body.withHeight(Math.max(0, top - GAP));
            }
        }
        return body;
    }
}
