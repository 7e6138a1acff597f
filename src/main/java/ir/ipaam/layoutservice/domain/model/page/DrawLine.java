package ir.ipaam.layoutservice.domain.model.page;

import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;

import java.util.List;

/** A stroked polyline, used for frames and cell borders. */
public record DrawLine(List<Point> points, LineStyle lineStyle) implements DrawInstruction {

    public DrawLine {
        if (points == null || points.size() < 2) {
            throw new IllegalArgumentException("A line needs at least two points");
        }
        points = List.copyOf(points);
    }

    @Override
    public DrawLine translate(double dx, double dy) {
        return new DrawLine(points.stream().map(p -> p.translate(dx, dy)).toList(), lineStyle);
    }
}
