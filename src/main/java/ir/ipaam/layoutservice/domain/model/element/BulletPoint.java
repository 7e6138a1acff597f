package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.LineMetrics;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;
import lombok.Getter;

/**
 * A list item: the content is indented and the marker is drawn in the gutter, right
 * aligned against the content. The marker appears only with the first part of the item.
 */
@Getter
public class BulletPoint implements Element {

    /** 10mm in points. */
    public static final double DEFAULT_INDENT = 28.35;
    /** 2mm in points. */
    public static final double DEFAULT_BULLET_SPACE = 5.67;
    public static final String DEFAULT_BULLET = "–";

    private final Element element;
    private final String bullet;
    private final double indent;
    private final double bulletSpace;
    private final boolean bulletRendered;

    public BulletPoint(Element element) {
        this(element, DEFAULT_BULLET);
    }

    public BulletPoint(Element element, String bullet) {
        this(element, bullet, DEFAULT_INDENT, DEFAULT_BULLET_SPACE, false);
    }

    public BulletPoint(Element element, String bullet, double indent, double bulletSpace, boolean bulletRendered) {
        this.element = element;
        this.bullet = bullet;
        this.indent = indent;
        this.bulletSpace = bulletSpace;
        this.bulletRendered = bulletRendered;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        RenderResult result = element.render(context, area.indent(indent, 0), style);
        boolean nothingDrawn = result.getHeight() == 0 && result.isPartial();
        if (nothingDrawn && result.getRemainder() == element && !result.isPageBreak()) {
            return RenderResult.nothingFits(this);
        }

        double height = result.getHeight();
        if (!bulletRendered && !nothingDrawn) {
            height = Math.max(height, drawBullet(context, area, style));
        }
        if (result.isDone()) {
            return result.isPageBreak() ? RenderResult.pageBreak(height) : RenderResult.done(height);
        }
        BulletPoint rest = new BulletPoint(result.getRemainder(), bullet, indent, bulletSpace,
                bulletRendered || !nothingDrawn);
        return result.isPageBreak()
                ? RenderResult.pageBreak(height, rest)
                : RenderResult.partial(height, rest);
    }

    private double drawBullet(RenderContext context, Area area, Style style) {
        TextMeasurer measurer = context.getMeasurer();
        double lineHeight = Math.min(measurer.lineHeight(style), area.getRemainingHeight());
        LineMetrics metrics = measurer.lineMetrics(style);
        double baseline = (measurer.lineHeight(style) - metrics.glyphHeight()) / 2 + metrics.ascent();
        double x = indent - bulletSpace - measurer.measure(bullet, style);
        area.drawText(x, baseline, bullet, measurer.font(style), style);
        return lineHeight;
    }
}
