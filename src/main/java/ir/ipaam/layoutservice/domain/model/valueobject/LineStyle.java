package ir.ipaam.layoutservice.domain.model.valueobject;

/** Stroke settings for frames and table borders. */
public record LineStyle(double thickness, RgbColor color) {

    public static final LineStyle DEFAULT = new LineStyle(0.5, RgbColor.BLACK);

    public LineStyle {
        if (!(thickness > 0)) {
            throw new IllegalArgumentException("Line thickness must be positive: " + thickness);
        }
        color = color == null ? RgbColor.BLACK : color;
    }

    public LineStyle withThickness(double value) {
        return new LineStyle(value, color);
    }

    public LineStyle withColor(RgbColor value) {
        return new LineStyle(thickness, value);
    }
}
