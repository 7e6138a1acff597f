package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

/**
 * Empty vertical space, either a number of lines of the current style or a fixed height.
 * Space that does not fit continues on the next page.
 */
public final class Spacer implements Element {

    private final double lines;
    private final double points;

    private Spacer(double lines, double points) {
        if (lines < 0 || points < 0) {
            throw new IllegalArgumentException("Spacer size must not be negative");
        }
        this.lines = lines;
        this.points = points;
    }

    public static Spacer lines(double lines) {
        return new Spacer(lines, 0);
    }

    public static Spacer points(double points) {
        return new Spacer(0, points);
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        double height = points + lines * context.getMeasurer().lineHeight(style);
        double remaining = area.getRemainingHeight();
        if (height <= remaining) {
            return RenderResult.done(height);
        }
        if (remaining <= 0) {
            return RenderResult.nothingFits(this);
        }
        return RenderResult.partial(remaining, Spacer.points(height - remaining));
    }

    public double getLines() {
        return lines;
    }

    public double getPoints() {
        return points;
    }
}
