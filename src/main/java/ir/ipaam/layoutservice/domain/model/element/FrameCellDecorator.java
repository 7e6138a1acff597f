package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;

import java.util.List;

/**
 * Cell borders. {@code inner} draws the lines between cells, {@code outer} the table
 * outline, and {@code cont} the horizontal edges where the table breaks across pages.
 */
public class FrameCellDecorator implements CellDecorator {

    private static final double PADDING = 2;

    private final boolean inner;
    private final boolean outer;
    private final boolean cont;
    private final LineStyle lineStyle;

    public FrameCellDecorator(boolean inner, boolean outer, boolean cont) {
        this(inner, outer, cont, LineStyle.DEFAULT);
    }

    public FrameCellDecorator(boolean inner, boolean outer, boolean cont, LineStyle lineStyle) {
        this.inner = inner;
        this.outer = outer;
        this.cont = cont;
        this.lineStyle = lineStyle;
    }

    @Override
    public Margins insets(CellPosition position) {
        return Margins.all(lineStyle.thickness() + PADDING);
    }

    @Override
    public void decorate(Area area, CellPosition position, double height) {
        double width = area.getWidth();
        if (drawsTop(position)) {
            line(area, 0, 0, width, 0);
        }
        if (drawsBottom(position)) {
            line(area, 0, height, width, height);
        }
        if (position.isFirstColumn() ? outer : inner) {
            line(area, 0, 0, 0, height);
        }
        if (position.isLastColumn() && outer) {
            line(area, width, 0, width, height);
        }
    }

    private boolean drawsTop(CellPosition position) {
        if (position.isFirstRow() && !position.continued()) {
            return outer;
        }
        return position.continued() && cont;
    }

    private boolean drawsBottom(CellPosition position) {
        if (position.split()) {
            return cont;
        }
        return position.isLastRow() ? outer : inner;
    }

    private void line(Area area, double x1, double y1, double x2, double y2) {
        area.drawLine(List.of(new Point(x1, y1), new Point(x2, y2)), lineStyle);
    }
}
