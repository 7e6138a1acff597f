package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.page.DrawImage;
import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;
import ir.ipaam.layoutservice.domain.model.page.DrawLine;
import ir.ipaam.layoutservice.domain.model.page.DrawRect;
import ir.ipaam.layoutservice.domain.model.page.DrawText;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;
import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.FontHandle;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * The drawable rectangle currently being filled. The origin is the top-left corner of
 * what is still free; drawing coordinates are relative to it. Width never changes and
 * the remaining height only shrinks.
 */
@Getter
public class Area {

    private final PageCanvas canvas;
    private final double x;
    private double y;
    private final double width;
    private double remainingHeight;

    public Area(PageCanvas canvas, double x, double y, double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Area dimensions must not be negative: " + width + "x" + height);
        }
        this.canvas = canvas;
        this.x = x;
        this.y = y;
        this.width = width;
        this.remainingHeight = height;
    }

    public Area copy() {
        return new Area(canvas, x, y, width, remainingHeight);
    }

    /** Moves the origin down; clamped so the remaining height never turns negative. */
    public void consume(double height) {
        double h = Math.max(0, Math.min(height, remainingHeight));
        if (h > 0) {
            canvas.markSpaceTaken();
        }
        y += h;
        remainingHeight -= h;
    }

    public Area inset(Margins margins) {
        return new Area(canvas,
                x + margins.left(),
                y + margins.top(),
                Math.max(0, width - margins.horizontal()),
                Math.max(0, remainingHeight - margins.vertical()));
    }

    public Area indent(double left, double right) {
        return new Area(canvas, x + left, y, Math.max(0, width - left - right), remainingHeight);
    }

    public Area withHeight(double height) {
        return new Area(canvas, x, y, width, Math.max(0, Math.min(height, remainingHeight)));
    }

    public Area withCanvas(PageCanvas other) {
        return new Area(other, x, y, width, remainingHeight);
    }

    /**
     * Splits this area into side-by-side columns proportional to {@code weights}.
     */
    public List<Area> splitHorizontally(double[] weights) {
        double total = 0;
        for (double w : weights) {
            total += w;
        }
        List<Area> columns = new ArrayList<>(weights.length);
        double offset = 0;
        for (double w : weights) {
            double columnWidth = total > 0 ? width * w / total : 0;
            columns.add(new Area(canvas, x + offset, y, columnWidth, remainingHeight));
            offset += columnWidth;
        }
        return columns;
    }

    /** True when nothing on the page body has taken space or drawn anything yet. */
    public boolean isPageBlank() {
        return !canvas.isUsed();
    }

    public void drawText(double dx, double baseline, String text, FontHandle font, Style style) {
        canvas.add(new DrawText(x + dx, y + baseline, text, font, style));
    }

    public void drawRect(double dx, double dy, double w, double h, RgbColor fill) {
        canvas.add(new DrawRect(x + dx, y + dy, w, h, fill));
    }

    public void drawImage(double dx, double dy, double w, double h, ImageHandle image) {
        canvas.add(new DrawImage(x + dx, y + dy, w, h, image));
    }

    public void drawLine(List<Point> points, LineStyle lineStyle) {
        canvas.add(new DrawLine(points.stream().map(p -> p.translate(x, y)).toList(), lineStyle));
    }

    /** Adds instructions expressed relative to this area's origin. */
    public void drawAll(List<DrawInstruction> relative, double dx, double dy) {
        for (DrawInstruction instruction : relative) {
            canvas.add(instruction.translate(x + dx, y + dy));
        }
    }
}
