package ir.ipaam.layoutservice.domain.model.valueobject;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    /** Stretches every line but the last one to the full width. */
    JUSTIFIED;

    /** Horizontal offset of content of the given width inside the available width. */
    public double offset(double contentWidth, double availableWidth) {
        return switch (this) {
            case CENTER -> (availableWidth - contentWidth) / 2.0;
            case RIGHT -> availableWidth - contentWidth;
            default -> 0.0;
        };
    }
}
